package guards;

import guards.parsing.EnumeratedConstants;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of one verification run. Fields missing from a parameter file keep
 * the defaults assigned here.
 */
public class VerificationParameters implements Serializable {
    public static final int DEFAULT_SOLVER_TIMEOUT = 10000;

    private String inputFile;
    private String reportFile;
    private String jsonReportFile = null;
    private String nameMappingFile = null;
    private int solverTimeout = DEFAULT_SOLVER_TIMEOUT;
    private int workers = 1;
    private List<String> enumeratedConstantPrefixes = new ArrayList<>(EnumeratedConstants.DEFAULT_PREFIXES);
    private List<String> enumeratedConstantNames = new ArrayList<>(EnumeratedConstants.DEFAULT_NAMES);
    private boolean areEnumeratedConstantsDistinct = false;

    public VerificationParameters() {
    }

    public VerificationParameters(String inputFile, String reportFile, int solverTimeout) {
        this.inputFile = inputFile;
        this.reportFile = reportFile;
        this.solverTimeout = solverTimeout;
    }

    public String getInputFile() {
        return this.inputFile;
    }

    public String getReportFile() {
        return this.reportFile;
    }

    public String getJsonReportFile() {
        return this.jsonReportFile;
    }

    public void setJsonReportFile(String jsonReportFile) {
        this.jsonReportFile = jsonReportFile;
    }

    public String getNameMappingFile() {
        return this.nameMappingFile;
    }

    public void setNameMappingFile(String nameMappingFile) {
        this.nameMappingFile = nameMappingFile;
    }

    public int getSolverTimeout() {
        return this.solverTimeout;
    }

    public int getWorkers() {
        return this.workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public EnumeratedConstants getEnumeratedConstants() {
        return new EnumeratedConstants(
            this.enumeratedConstantPrefixes == null ? EnumeratedConstants.DEFAULT_PREFIXES : this.enumeratedConstantPrefixes,
            this.enumeratedConstantNames == null ? EnumeratedConstants.DEFAULT_NAMES : this.enumeratedConstantNames
        );
    }

    public void setEnumeratedConstants(List<String> prefixes, List<String> names) {
        this.enumeratedConstantPrefixes = new ArrayList<>(prefixes);
        this.enumeratedConstantNames = new ArrayList<>(names);
    }

    public boolean areEnumeratedConstantsDistinct() {
        return this.areEnumeratedConstantsDistinct;
    }

    public void setEnumeratedConstantsDistinct(boolean areEnumeratedConstantsDistinct) {
        this.areEnumeratedConstantsDistinct = areEnumeratedConstantsDistinct;
    }
}
