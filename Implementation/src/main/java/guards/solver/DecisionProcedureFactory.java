package guards.solver;

public interface DecisionProcedureFactory {
    DecisionProcedure open();
}
