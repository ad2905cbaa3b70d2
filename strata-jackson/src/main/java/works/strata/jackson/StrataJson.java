package works.strata.jackson;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import works.strata.Strata;
import works.strata.options.DecodingOptions;
import works.strata.options.EncodingOptions;
import works.strata.options.ValidationOptions;
import works.strata.result.DecodingError;
import works.strata.result.Result;
import works.strata.result.ValidationError;
import works.strata.result.ValueError;
import works.strata.types.Absent;
import works.strata.types.Type;

import static java.util.Objects.requireNonNull;

/**
 * Reads and writes Strata values as JSON text or {@link JsonNode} trees.
 * <p>
 * JSON is parsed into raw values (maps, lists, strings, numbers, booleans and null)
 * which are then decoded against a {@link Type}. Encoding goes the other way.
 * A {@link tools.jackson.databind.node.MissingNode MissingNode} reads as {@link Absent#VALUE}.
 */
public final class StrataJson {
	private final JsonMapper mapper;

	public StrataJson() {
		this(JsonMapper.builder().build());
	}

	public StrataJson(JsonMapper mapper) {
		this.mapper = requireNonNull(mapper);
	}

	public JsonMapper mapper() {
		return mapper;
	}

	/**
	 * Parses JSON text without decoding it.
	 *
	 * @return a single error at the root if {@code json} is not well-formed
	 */
	public Result<Object, List<DecodingError>> parse(String json) {
		try {
			return Result.ok(mapper.readValue(json, Object.class));
		} catch (JacksonException e) {
			LOGGER.debug("Malformed JSON: {}", e.getOriginalMessage());
			return Result.failure(DecodingError.of("JSON (" + e.getOriginalMessage() + ")", json));
		}
	}

	public Object toRaw(JsonNode node) {
		if (node.isMissingNode()) {
			return Absent.VALUE;
		}
		return mapper.treeToValue(node, Object.class);
	}

	public Result<Object, List<DecodingError>> decode(Type type, String json) {
		return decode(type, json, DecodingOptions.DEFAULT);
	}

	public Result<Object, List<DecodingError>> decode(Type type, String json, DecodingOptions options) {
		return parse(json).chain(raw -> Strata.decode(type, raw, options));
	}

	public Result<Object, List<DecodingError>> decode(Type type, JsonNode node) {
		return decode(type, node, DecodingOptions.DEFAULT);
	}

	public Result<Object, List<DecodingError>> decode(Type type, JsonNode node, DecodingOptions options) {
		return Strata.decode(type, toRaw(node), options);
	}

	public Result<Object, List<? extends ValueError>> decodeAndValidate(Type type, String json) {
		return decodeAndValidate(type, json, DecodingOptions.DEFAULT);
	}

	public Result<Object, List<? extends ValueError>> decodeAndValidate(Type type, String json, DecodingOptions options) {
		var parsed = parse(json);
		if (parsed.isFailure()) {
			return Result.failure(parsed.error());
		}
		return Strata.decodeAndValidate(type, parsed.value(), options);
	}

	public String encodeToString(Type type, Object value) {
		return encodeToString(type, value, EncodingOptions.DEFAULT);
	}

	/**
	 * @throws works.strata.exceptions.TypeGraphException if {@code value} doesn't have the shape {@code type} calls for
	 */
	public String encodeToString(Type type, Object value, EncodingOptions options) {
		return mapper.writeValueAsString(Strata.encode(type, value, options));
	}

	public JsonNode encodeToTree(Type type, Object value) {
		return encodeToTree(type, value, EncodingOptions.DEFAULT);
	}

	public JsonNode encodeToTree(Type type, Object value, EncodingOptions options) {
		return mapper.valueToTree(Strata.encode(type, value, options));
	}

	public Result<String, List<ValidationError>> validateAndEncodeToString(Type type, Object value) {
		return validateAndEncodeToString(type, value, ValidationOptions.DEFAULT, EncodingOptions.DEFAULT);
	}

	public Result<String, List<ValidationError>> validateAndEncodeToString(Type type, Object value, ValidationOptions validationOptions, EncodingOptions encodingOptions) {
		return Strata.validateAndEncode(type, value, validationOptions, encodingOptions)
			.map(mapper::writeValueAsString);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(StrataJson.class);
}
