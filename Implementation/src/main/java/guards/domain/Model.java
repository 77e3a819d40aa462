package guards.domain;

public interface Model {
    void accept(ModelVisitor visitor);
}
