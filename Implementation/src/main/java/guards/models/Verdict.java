package guards.models;

import guards.domain.Constant;
import guards.domain.Variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The outcome of one equivalence check. Only {@link Classification#NEQ}
 * verdicts carry a counterexample and only {@link Classification#ERROR}
 * verdicts carry an error message.
 */
public class Verdict {
    public final Classification result;
    public final Map<Variable, Constant> counterexample;
    public final String error;

    private Verdict(Classification result, Map<Variable, Constant> counterexample, String error) {
        assert result != Classification.ERROR || error != null;

        this.result = result;
        this.counterexample = Collections.unmodifiableMap(new LinkedHashMap<>(counterexample));
        this.error = error;
    }

    public static Verdict equivalent() {
        return new Verdict(Classification.EQ, Collections.emptyMap(), null);
    }

    public static Verdict notEquivalent(Map<Variable, Constant> counterexample) {
        return new Verdict(Classification.NEQ, counterexample, null);
    }

    public static Verdict error(String error) {
        return new Verdict(Classification.ERROR, Collections.emptyMap(), error == null ? "Unknown error" : error);
    }

    public boolean isEquivalent() {
        return this.result == Classification.EQ;
    }

    public boolean isNotEquivalent() {
        return this.result == Classification.NEQ;
    }

    public boolean isError() {
        return this.result == Classification.ERROR;
    }

    @Override
    public String toString() {
        switch (this.result) {
            case NEQ:
                return this.result + " " + this.counterexample;
            case ERROR:
                return this.result + " " + this.error;
            default:
                return this.result.toString();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Verdict verdict = (Verdict) o;
        return result == verdict.result
            && counterexample.equals(verdict.counterexample)
            && Objects.equals(error, verdict.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(result, counterexample, error);
    }
}
