package SFC.Expr;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ExprParserTest {

  @Test
  void testBlankGuardIsTrue() throws ExprSyntaxException {
    Assertions.assertEquals(Expr.TRUE, ExprParser.parseGuard(""));
    Assertions.assertEquals(Expr.TRUE, ExprParser.parseGuard(null));
    Assertions.assertEquals(Expr.TRUE, ExprParser.parseGuard("True"));
    Assertions.assertEquals(Expr.FALSE, ExprParser.parseGuard("false"));
  }

  @Test
  void testComparison() throws ExprSyntaxException {
    Expr guard = ExprParser.parseGuard("i <= n");
    Assertions.assertEquals(
        new Expr.Binary(Expr.Op.LE, new Expr.Variable("i"), new Expr.Variable("n")), guard);
    Assertions.assertEquals("i <= n", guard.toString());
    Assertions.assertTrue(guard.holds(Map.of("i", 2, "n", 2)));
    Assertions.assertFalse(guard.holds(Map.of("i", 3, "n", 2)));
  }

  @Test
  void testPrecedence() throws ExprSyntaxException {
    Expr e = ExprParser.parseGuard("1 + 2 * 3");
    Assertions.assertEquals(7, e.eval(Map.of()));
    Assertions.assertEquals("1 + 2 * 3", e.toString());

    e = ExprParser.parseGuard("(1 + 2) * 3");
    Assertions.assertEquals(9, e.eval(Map.of()));
    Assertions.assertEquals("(1 + 2) * 3", e.toString());

    e = ExprParser.parseGuard("10 - (4 - 1)");
    Assertions.assertEquals(7, e.eval(Map.of()));
  }

  @Test
  void testBooleanOperators() throws ExprSyntaxException {
    Map<String, Integer> env = Map.of("a", 1, "b", 0);
    Assertions.assertTrue(ExprParser.parseGuard("a and not b").holds(env));
    Assertions.assertTrue(ExprParser.parseGuard("a && !b").holds(env));
    Assertions.assertTrue(ExprParser.parseGuard("b or a").holds(env));
    Assertions.assertFalse(ExprParser.parseGuard("b || a == 0").holds(env));
    Assertions.assertTrue(ExprParser.parseGuard("a <> b").holds(env));
    Assertions.assertTrue(ExprParser.parseGuard("a = 1").holds(env));
  }

  @Test
  void testDivisionByZeroIsZero() throws ExprSyntaxException {
    Assertions.assertEquals(0, ExprParser.parseGuard("5 / x").eval(Map.of("x", 0)));
    Assertions.assertEquals(0, ExprParser.parseGuard("5 % x").eval(Map.of("x", 0)));
    Assertions.assertEquals(-2, ExprParser.parseGuard("-x * 2").eval(Map.of("x", 1)));
  }

  @Test
  void testParseAction() throws ExprSyntaxException {
    Action action = ExprParser.parseAction("i := 1; fact := fact * i;");
    Assertions.assertEquals(2, action.assignments().size());
    Assertions.assertEquals("i", action.assignments().get(0).variable());
    Assertions.assertEquals("i := 1; fact := fact * i", action.toString());
    Assertions.assertTrue(ExprParser.parseAction("  ").isEmpty());
  }

  @Test
  void testObservableAssignments() throws ExprSyntaxException {
    Action action = ExprParser.parseAction("i := 1; temp := 0; fact := 1");
    Action observed = action.observable(Set.of("i", "fact"));
    Assertions.assertEquals(List.of("i", "fact"),
        observed.assignments().stream().map(Assignment::variable).toList());
    Assertions.assertSame(action, action.observable(Set.of("i", "temp", "fact")));
  }

  @Test
  void testSyntaxErrors() {
    ExprSyntaxException e = Assertions.assertThrows(ExprSyntaxException.class,
        () -> ExprParser.parseGuard("i <= "));
    Assertions.assertEquals("i <= ", e.getText());
    Assertions.assertThrows(ExprSyntaxException.class, () -> ExprParser.parseGuard("(a"));
    Assertions.assertThrows(ExprSyntaxException.class, () -> ExprParser.parseGuard("a $ b"));
    Assertions.assertThrows(ExprSyntaxException.class, () -> ExprParser.parseAction("x = 1"));
    Assertions.assertThrows(ExprSyntaxException.class, () -> ExprParser.parseAction("x := 1 y := 2"));
  }

  @Test
  void testAndDropsDuplicates() throws ExprSyntaxException {
    Expr a = ExprParser.parseGuard("i > n");
    Expr b = ExprParser.parseGuard("init");
    Assertions.assertSame(a, Expr.and(Expr.TRUE, a));
    Assertions.assertSame(a, Expr.and(a, Expr.TRUE));
    Expr ab = Expr.and(a, b);
    Assertions.assertEquals(ab, Expr.and(ab, a));
    Assertions.assertEquals(ab, Expr.and(ab, b));
    Assertions.assertEquals(Expr.FALSE, Expr.and(a, Expr.FALSE));
  }
}
