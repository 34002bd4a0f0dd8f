package scadflow.runtime.interpreter;

import com.scadflow.compiler.ast.Argument;
import scadflow.runtime.ScadUndef;
import scadflow.runtime.ScadValue;
import scadflow.runtime.builtin.Signature;
import scadflow.runtime.module.ModuleArgument;
import scadflow.runtime.module.ModuleException;
import scadflow.runtime.module.ModuleParameter;
import scadflow.runtime.module.ProcessedModuleCall;
import scadflow.runtime.module.ProcessedModuleDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 实参到形参的绑定
 *
 * <p>位置参数按声明顺序绑定，命名参数按名称绑定；以 $ 开头的命名参数作为特殊变量接收。
 * 模块调用中的未知参数与多余位置参数是模块错误；内置调用中则记录警告后忽略。</p>
 */
public final class ArgumentBinder {

    private static final Logger LOG = Logger.getLogger(ArgumentBinder.class.getName());

    private final ExpressionEvaluator evaluator;
    private final ScopeManager scopes;

    public ArgumentBinder(ExpressionEvaluator evaluator, ScopeManager scopes) {
        this.evaluator = evaluator;
        this.scopes = scopes;
    }

    /**
     * 绑定模块调用的实参并写入调用帧作用域
     *
     * <p>实参在调用方作用域求值；省略的形参取默认值，默认值在调用帧中按声明顺序求值，
     * 因此可以引用之前的形参；无默认值的形参为 undef。</p>
     *
     * @return 形参名（及特殊变量）到值的映射，按绑定顺序
     * @throws ModuleException 未知命名参数、多余位置参数或重复绑定
     */
    public Map<String, ScadValue> bindModuleArguments(ProcessedModuleDefinition definition, ProcessedModuleCall call,
                                                      VariableScope callerScope, VariableScope frameScope) {
        String module = definition.getModuleName();
        List<ModuleParameter> params = definition.getParameters();
        VariableLookup callerVars = scopes.lookup(callerScope);

        Map<String, ScadValue> explicit = new LinkedHashMap<>();
        Map<String, ScadValue> specials = new LinkedHashMap<>();
        int position = 0;
        for (ModuleArgument arg : call.getArguments()) {
            ScadValue value = evaluator.evaluateExpression(arg.getValue(), callerVars);
            String target;
            if (arg.isNamed()) {
                if (arg.getName().startsWith("$")) {
                    specials.put(arg.getName(), value);
                    continue;
                }
                if (definition.indexOfParameter(arg.getName()) < 0) {
                    throw new ModuleException("Unknown parameter '" + arg.getName() + "' for module '"
                            + module + "'", module);
                }
                target = arg.getName();
            } else {
                if (position >= params.size()) {
                    throw new ModuleException("Too many arguments for module '" + module + "': expected at most "
                            + params.size() + ", got " + countPositional(call), module);
                }
                target = params.get(position++).getName();
            }
            if (explicit.containsKey(target)) {
                throw new ModuleException("Parameter '" + target + "' of module '" + module
                        + "' is given more than once", module);
            }
            explicit.put(target, value);
        }

        Map<String, ScadValue> bound = new LinkedHashMap<>();
        for (Map.Entry<String, ScadValue> e : specials.entrySet()) {
            scopes.setVariable(frameScope, e.getKey(), e.getValue());
        }
        for (ModuleParameter p : params) {
            if (explicit.containsKey(p.getName())) {
                scopes.setVariable(frameScope, p.getName(), explicit.get(p.getName()));
            }
        }
        VariableLookup frameVars = scopes.lookup(frameScope);
        for (ModuleParameter p : params) {
            ScadValue value = explicit.get(p.getName());
            if (value == null) {
                value = p.getDefaultValue() != null
                        ? evaluator.evaluateExpression(p.getDefaultValue(), frameVars)
                        : ScadUndef.UNDEF;
                scopes.setVariable(frameScope, p.getName(), value);
            }
            bound.put(p.getName(), value);
        }
        bound.putAll(specials);
        return bound;
    }

    /**
     * 绑定内置调用的实参
     *
     * @return 参数名到值的映射；缺省的参数取签名默认值，无默认值的参数不出现
     */
    public Map<String, ScadValue> bindBuiltinArguments(Signature signature, List<Argument> arguments,
                                                       VariableLookup vars) {
        Map<String, ScadValue> bound = new LinkedHashMap<>();
        int position = 0;
        for (Argument arg : arguments) {
            ScadValue value = evaluator.evaluateExpression(arg.getValue(), vars);
            if (arg.isNamed()) {
                if (arg.getName().startsWith("$") || signature.accepts(arg.getName())) {
                    bound.put(arg.getName(), value);
                } else {
                    LOG.log(Level.WARNING, "Ignoring unknown argument ''{0}'' for {1}",
                            new Object[]{arg.getName(), signature.getName()});
                }
            } else {
                String name = signature.positionalName(position++);
                if (name == null) {
                    LOG.log(Level.WARNING, "Ignoring extra positional argument {0} for {1}",
                            new Object[]{position, signature.getName()});
                } else if (!bound.containsKey(name)) {
                    bound.put(name, value);
                }
            }
        }
        for (String name : signature.parameterNames()) {
            if (!bound.containsKey(name)) {
                ScadValue def = signature.defaultValue(name);
                if (def != null) {
                    bound.put(name, def);
                }
            }
        }
        return bound;
    }

    private static int countPositional(ProcessedModuleCall call) {
        int n = 0;
        for (ModuleArgument a : call.getArguments()) {
            if (!a.isNamed()) n++;
        }
        return n;
    }
}
