package works.strata.custom;

import java.util.List;
import java.util.Random;
import java.util.regex.Pattern;
import works.strata.arbitrary.Arbitrary;
import works.strata.options.DecodingOptions;
import works.strata.options.EncodingOptions;
import works.strata.options.ValidationOptions;
import works.strata.result.DecodingError;
import works.strata.result.Result;
import works.strata.result.ValidationError;
import works.strata.types.CustomBehaviour;

final class EmailBehaviour implements CustomBehaviour<Void> {
	static final EmailBehaviour INSTANCE = new EmailBehaviour();

	static final int MAX_LENGTH = 320;
	static final int MAX_LOCAL_PART_LENGTH = 64;
	private static final Pattern EMAIL = Pattern.compile(
		"[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+(\\.[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+)*"
			+ "@([A-Za-z0-9]([A-Za-z0-9-]*[A-Za-z0-9])?\\.)+[A-Za-z]{2,}");

	private EmailBehaviour() { }

	@Override
	public Result<Object, List<DecodingError>> decode(Object raw, DecodingOptions options, Void customOptions) {
		if (raw instanceof String) {
			return Result.ok(raw);
		} else {
			return Result.failure(DecodingError.of("email", raw));
		}
	}

	@Override
	public Object encode(Object value, EncodingOptions options, Void customOptions) {
		return value;
	}

	@Override
	public Result<Void, List<ValidationError>> validate(Object value, ValidationOptions options, Void customOptions) {
		String email = (String) value;
		if (email.length() > MAX_LENGTH) {
			return Result.failure(ValidationError.of("email longer than max length (" + MAX_LENGTH + ")", value));
		}
		int at = email.lastIndexOf('@');
		if (at > MAX_LOCAL_PART_LENGTH) {
			return Result.failure(ValidationError.of("email local part longer than max length (" + MAX_LOCAL_PART_LENGTH + ")", value));
		}
		if (!EMAIL.matcher(email).matches()) {
			return Result.failure(ValidationError.of("invalid email", value));
		}
		return Result.ok(null);
	}

	@Override
	public Arbitrary arbitrary(int maxDepth, Void customOptions) {
		return random -> word(random, 1, 12) + "@" + word(random, 1, 10) + "." + word(random, 2, 4);
	}

	private static String word(Random random, int minLength, int maxLength) {
		int length = minLength + random.nextInt(maxLength - minLength + 1);
		StringBuilder sb = new StringBuilder(length);
		for (int i = 0; i < length; i++) {
			sb.append((char) ('a' + random.nextInt(26)));
		}
		return sb.toString();
	}
}
