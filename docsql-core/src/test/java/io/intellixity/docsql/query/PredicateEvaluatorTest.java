package io.intellixity.docsql.query;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.docsql.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class PredicateEvaluatorTest {
  private static final Map<String, Object> ROW = Map.of("name", "Alice", "age", 34, "score", 7.5);

  @Test
  void comparesNumbersAcrossTypes() {
    assertTrue(PredicateEvaluator.matches(eq("age", 34L), ROW));
    assertTrue(PredicateEvaluator.matches(gt("score", 7), ROW));
    assertFalse(PredicateEvaluator.matches(le("age", 33), ROW));
  }

  @Test
  void membership() {
    assertTrue(PredicateEvaluator.matches(in("age", List.of(1, 34)), ROW));
    assertFalse(PredicateEvaluator.matches(nin("age", List.of(34)), ROW));
    assertFalse(PredicateEvaluator.matches(in("age", List.of()), ROW));
    assertTrue(PredicateEvaluator.matches(nin("age", List.of()), ROW));
  }

  @Test
  void likePatterns() {
    assertTrue(PredicateEvaluator.matches(like("name", "Al%"), ROW));
    assertFalse(PredicateEvaluator.matches(like("name", "al%"), ROW));
    assertTrue(PredicateEvaluator.matches(ilike("name", "al_ce"), ROW));
    assertFalse(PredicateEvaluator.matches(like("name", "A.*"), ROW));
  }

  @Test
  void nullsFollowThreeValuedLogic() {
    Map<String, Object> row = new HashMap<>(ROW);
    row.put("email", null);
    assertTrue(PredicateEvaluator.matches(isNull("email"), row));
    assertFalse(PredicateEvaluator.matches(notNull("email"), row));
    // unknown stays unknown under negation
    assertFalse(PredicateEvaluator.matches(eq("email", "x"), row));
    assertFalse(PredicateEvaluator.matches(not(eq("email", "x")), row));
    assertTrue(PredicateEvaluator.matches(or(eq("email", "x"), eq("name", "Alice")), row));
  }

  @Test
  void nullListElementMakesANonMatchUnknown() {
    List<Object> withNull = Arrays.asList(1, null);
    assertFalse(PredicateEvaluator.matches(nin("age", withNull), ROW));
    assertFalse(PredicateEvaluator.matches(in("age", withNull), ROW));
    assertFalse(PredicateEvaluator.matches(not(in("age", withNull)), ROW));
    // a hit is still definite
    assertTrue(PredicateEvaluator.matches(in("age", Arrays.asList(34, null)), ROW));
    assertFalse(PredicateEvaluator.matches(nin("age", Arrays.asList(34, null)), ROW));
    assertTrue(PredicateEvaluator.matches(not(nin("age", Arrays.asList(34, null))), ROW));
  }

  @Test
  void groupsAndNegation() {
    assertTrue(PredicateEvaluator.matches(and(eq("name", "Alice"), not(lt("age", 30))), ROW));
    assertFalse(PredicateEvaluator.matches(eq("name", "Alice").negate(), ROW));
    assertTrue(PredicateEvaluator.matches(null, ROW));
  }

  @Test
  void rawCannotBeEvaluated() {
    assertThrows(UnsupportedOperationException.class, () -> PredicateEvaluator.matches(raw("1 = 1"), ROW));
  }
}
