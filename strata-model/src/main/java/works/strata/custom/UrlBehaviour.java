package works.strata.custom;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Random;
import works.strata.arbitrary.Arbitrary;
import works.strata.options.DecodingOptions;
import works.strata.options.EncodingOptions;
import works.strata.options.ValidationOptions;
import works.strata.result.DecodingError;
import works.strata.result.Result;
import works.strata.result.ValidationError;
import works.strata.types.CustomBehaviour;

final class UrlBehaviour implements CustomBehaviour<Void> {
	static final UrlBehaviour INSTANCE = new UrlBehaviour();

	private UrlBehaviour() { }

	@Override
	public Result<Object, List<DecodingError>> decode(Object raw, DecodingOptions options, Void customOptions) {
		if (raw instanceof URI uri && isUrl(uri)) {
			return Result.ok(uri);
		} else if (raw instanceof String s) {
			try {
				URI uri = new URI(s);
				if (isUrl(uri)) {
					return Result.ok(uri);
				}
			} catch (URISyntaxException e) {
				return Result.failure(DecodingError.of("URL (" + e.getReason() + ")", raw));
			}
		}
		return Result.failure(DecodingError.of("URL", raw));
	}

	private static boolean isUrl(URI uri) {
		return uri.isAbsolute() && uri.getHost() != null;
	}

	@Override
	public Object encode(Object value, EncodingOptions options, Void customOptions) {
		return value.toString();
	}

	@Override
	public Result<Void, List<ValidationError>> validate(Object value, ValidationOptions options, Void customOptions) {
		return Result.ok(null);
	}

	@Override
	public Arbitrary arbitrary(int maxDepth, Void customOptions) {
		return random -> URI.create((random.nextBoolean() ? "https" : "http") + "://"
			+ word(random) + ".example/" + word(random));
	}

	private static String word(Random random) {
		int length = 1 + random.nextInt(10);
		StringBuilder sb = new StringBuilder(length);
		for (int i = 0; i < length; i++) {
			sb.append((char) ('a' + random.nextInt(26)));
		}
		return sb.toString();
	}
}
