package com.scadflow.compiler.ast;

import com.scadflow.compiler.ast.expr.*;
import com.scadflow.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 语句 ============

    default R visitCall(CallNode node, C ctx) { return null; }

    default R visitModuleDefinition(ModuleDefinitionNode node, C ctx) { return null; }

    default R visitModuleInstantiation(ModuleInstantiationNode node, C ctx) { return null; }

    default R visitIf(IfNode node, C ctx) { return null; }

    default R visitFor(ForNode node, C ctx) { return null; }

    default R visitLet(LetNode node, C ctx) { return null; }

    default R visitAssignment(AssignmentNode node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(LiteralExpr node, C ctx) { return null; }

    default R visitIdentifier(IdentifierExpr node, C ctx) { return null; }

    default R visitBinary(BinaryExpr node, C ctx) { return null; }

    default R visitUnary(UnaryExpr node, C ctx) { return null; }

    default R visitVector(VectorExpr node, C ctx) { return null; }

    default R visitRange(RangeExpr node, C ctx) { return null; }

    default R visitTernary(TernaryExpr node, C ctx) { return null; }

    default R visitIndex(IndexExpr node, C ctx) { return null; }

    default R visitMember(MemberExpr node, C ctx) { return null; }

    default R visitFunctionCall(CallExpr node, C ctx) { return null; }
}
