package works.strata.result;

import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultTest {

	@Test
	void ok() {
		Result<Integer, String> result = Result.ok(2);
		assertTrue(result.isOk());
		assertEquals(2, result.value());
		assertEquals(3, result.map(x -> x + 1).value());
		assertEquals(2, result.mapError(String::length).value());
		assertThrows(NoSuchElementException.class, result::error);
	}

	@Test
	void okMayHoldNull() {
		Result<Object, String> result = Result.ok(null);
		assertTrue(result.isOk());
		assertNull(result.value());
	}

	@Test
	void failure() {
		Result<Integer, String> result = Result.failure("bad");
		assertTrue(result.isFailure());
		assertEquals("bad", result.error());
		assertEquals("bad", result.map(x -> x + 1).error());
		assertEquals(3, result.mapError(String::length).error());
		assertEquals(7, result.orElse(7));
		assertThrows(NoSuchElementException.class, result::value);
		assertThrows(IllegalStateException.class, () -> result.orElseThrow(IllegalStateException::new));
	}

	@Test
	void chain() {
		Result<Integer, String> start = Result.ok(4);
		assertEquals(2, start.<Integer>chain(x -> Result.ok(x / 2)).value());
		assertFalse(start.<Integer>chain(x -> Result.failure("odd")).isOk());
	}
}
