package works.strata.arbitrary;

import java.util.Random;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegexGeneratorTest {

	@ParameterizedTest
	@MethodSource("supportedPatterns")
	void generatedStrings_matchThePattern(String regex) {
		Pattern pattern = Pattern.compile(regex);
		RegexGenerator generator = RegexGenerator.parse(regex);
		Random random = new Random(123);
		for (int i = 0; i < 200; i++) {
			String generated = generator.generate(random);
			assertTrue(pattern.matcher(generated).matches(), () -> "/" + regex + "/ doesn't match \"" + generated + "\"");
		}
	}

	static Stream<String> supportedPatterns() {
		return Stream.of(
			"abc",
			"^[a-z]+$",
			"[A-Z][a-z]{2,5}",
			"\\d{3}-\\d{4}",
			"(foo|bar)+baz?",
			"(?:ab|cd)*",
			"(?<year>\\d{4})-(?<month>0[1-9]|1[0-2])",
			"[^aeiou ]{1,3}",
			"\\w+@\\w+\\.com",
			"x{2,}",
			"a.c",
			"[\\-_.]+",
			"\\u0041+?"
		);
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"(a)\\1",
		"\\bword\\b",
		"a(?=b)",
		"[[a-z]]",
		"*a",
		"a{2",
		"(ab",
		"\\p{Alpha}"
	})
	void unsupportedPatterns_throw(String regex) {
		assertThrows(RegexGenerator.UnsupportedRegexException.class, () -> RegexGenerator.parse(regex));
	}
}
