package guards.parsing;

import guards.domain.Variable;
import guards.domain.VariableType;

import java.util.*;

/**
 * The variable table of a single verification call. Both expressions of a
 * pair are parsed against the same factory so that equal names resolve to
 * the same handle. The first request for a name fixes its type.
 */
public class VariableFactory {
    private final Map<String, VariableType> inferredTypes;
    private final EnumeratedConstants constants;
    private final Map<String, Variable> variables = new LinkedHashMap<>();

    public VariableFactory(Map<String, VariableType> inferredTypes, EnumeratedConstants constants) {
        this.inferredTypes = new HashMap<>(inferredTypes);
        this.constants = constants;
    }

    public VariableType getInferredType(String name) {
        return this.inferredTypes.getOrDefault(name, VariableType.BOOLEAN);
    }

    public Variable getOrCreate(String name, VariableType type) {
        Variable variable = this.variables.get(name);

        if (variable == null) {
            variable = new Variable(name, type, this.constants.matches(name));
            this.variables.put(name, variable);
        } else if (variable.type != type) {
            throw new TypeConflictException(name, variable.type, type);
        }

        return variable;
    }

    public Variable get(String name) {
        return this.variables.get(name);
    }

    public Collection<Variable> getVariables() {
        return Collections.unmodifiableCollection(this.variables.values());
    }
}
