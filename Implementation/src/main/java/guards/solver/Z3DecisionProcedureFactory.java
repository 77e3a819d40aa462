package guards.solver;

import java.util.HashMap;
import java.util.Map;

public class Z3DecisionProcedureFactory implements DecisionProcedureFactory {
    private final Map<String, String> settings = new HashMap<>();

    /**
     * @param timeout maximum time per query in milliseconds, 0 for none.
     */
    public Z3DecisionProcedureFactory(int timeout) {
        this.settings.put("model", "true");
        if (timeout > 0) {
            this.settings.put("timeout", Integer.toString(timeout));
        }
    }

    @Override
    public DecisionProcedure open() {
        try {
            return new Z3DecisionProcedure(this.settings);
        } catch (UnsatisfiedLinkError e) {
            throw new DecisionProcedureException("Unable to load the z3 native library: " + e.getMessage(), e);
        }
    }
}
