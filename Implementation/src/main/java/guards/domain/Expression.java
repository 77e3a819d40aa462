package guards.domain;

public interface Expression extends Model {
}
