package guards.domain;

public enum VariableType {
    BOOLEAN("Bool"),
    INTEGER("Int");

    private final String sort;

    VariableType(final String sort) {
        this.sort = sort;
    }

    @Override
    public String toString() {
        return sort;
    }
}
