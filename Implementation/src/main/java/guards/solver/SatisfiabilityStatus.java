package guards.solver;

public enum SatisfiabilityStatus {
    SATISFIABLE,
    UNSATISFIABLE,
    UNKNOWN
}
