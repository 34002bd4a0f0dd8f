package com.scadflow.compiler.ast.stmt;

import com.scadflow.compiler.ast.AstVisitor;
import com.scadflow.compiler.ast.ParameterDecl;
import com.scadflow.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 模块定义 module name(params) { body }
 */
public class ModuleDefinitionNode extends Statement {
    private final String name;
    private final List<ParameterDecl> parameters;
    private final List<Statement> body;

    public ModuleDefinitionNode(SourceLocation location, String name,
                                List<ParameterDecl> parameters, List<Statement> body) {
        super(location);
        this.name = name;
        this.parameters = Collections.unmodifiableList(parameters);
        this.body = body != null ? Collections.unmodifiableList(body) : null;
    }

    public String getName() {
        return name;
    }

    public List<ParameterDecl> getParameters() {
        return parameters;
    }

    /** 模块体，可为空列表；手工构造的非法节点可能为 null */
    public List<Statement> getBody() {
        return body;
    }

    @Override
    public String getType() {
        return "module_definition";
    }

    @Override
    public List<Statement> getNestedNodes() {
        return body != null ? body : Collections.<Statement>emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleDefinition(this, context);
    }
}
