package works.strata.options;

import lombok.Builder;
import lombok.With;

import static java.util.Objects.requireNonNull;

@With
@Builder(toBuilder = true)
public record ValidationOptions(
	ErrorReportingStrategy errorReportingStrategy
) {
	public static final ValidationOptions DEFAULT = new ValidationOptions(ErrorReportingStrategy.STOP_AT_FIRST_ERROR);

	public ValidationOptions {
		requireNonNull(errorReportingStrategy);
	}

	public boolean allErrors() {
		return errorReportingStrategy == ErrorReportingStrategy.ALL_ERRORS;
	}
}
