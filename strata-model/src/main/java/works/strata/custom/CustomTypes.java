package works.strata.custom;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import works.strata.types.CustomType;
import works.strata.types.Type;
import works.strata.types.Types;

/**
 * Ready-made {@link CustomType custom types} for common formats.
 */
public final class CustomTypes {
	private CustomTypes() { }

	/**
	 * An {@link Instant} encoded as an ISO-8601 string.
	 */
	public static CustomType<DateTimeOptions> datetime() {
		return datetime(DateTimeOptions.NONE);
	}

	public static CustomType<DateTimeOptions> datetime(DateTimeOptions options) {
		return Types.custom("datetime", DateTimeBehaviour.INSTANCE, options);
	}

	/**
	 * An {@link Instant} encoded as milliseconds since the epoch.
	 */
	public static CustomType<DateTimeOptions> timestamp() {
		return timestamp(DateTimeOptions.NONE);
	}

	public static CustomType<DateTimeOptions> timestamp(DateTimeOptions options) {
		return Types.custom("timestamp", TimestampBehaviour.INSTANCE, options);
	}

	/**
	 * A {@link UUID} encoded in its canonical string form.
	 */
	public static CustomType<Void> uuid() {
		return Types.custom("uuid", UuidBehaviour.INSTANCE, null);
	}

	/**
	 * A {@link String} holding an email address.
	 */
	public static CustomType<Void> email() {
		return Types.custom("email", EmailBehaviour.INSTANCE, null);
	}

	/**
	 * An absolute {@link URI} with a scheme and a host.
	 */
	public static CustomType<Void> url() {
		return Types.custom("url", UrlBehaviour.INSTANCE, null);
	}

	/**
	 * A TCP port number as a {@link Long}.
	 */
	public static CustomType<Void> port() {
		return Types.custom("port", PortBehaviour.INSTANCE, null);
	}

	/**
	 * A {@link BigDecimal} encoded as a string, so no precision is lost on the wire.
	 */
	public static CustomType<DecimalOptions> decimal() {
		return decimal(DecimalOptions.NONE);
	}

	public static CustomType<DecimalOptions> decimal(DecimalOptions options) {
		return Types.custom("decimal", DecimalBehaviour.INSTANCE, options);
	}

	/**
	 * A {@link Map} from arbitrary string keys to values of {@code valueType}.
	 */
	public static CustomType<Type> record(Type valueType) {
		return Types.custom("record", RecordBehaviour.INSTANCE, valueType);
	}
}
