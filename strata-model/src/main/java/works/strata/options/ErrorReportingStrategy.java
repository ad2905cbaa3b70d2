package works.strata.options;

public enum ErrorReportingStrategy {
	STOP_AT_FIRST_ERROR,
	ALL_ERRORS,
}
