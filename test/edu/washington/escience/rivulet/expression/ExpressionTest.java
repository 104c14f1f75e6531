package edu.washington.escience.rivulet.expression;

import static edu.washington.escience.rivulet.expression.Expressions.add;
import static edu.washington.escience.rivulet.expression.Expressions.and;
import static edu.washington.escience.rivulet.expression.Expressions.equal;
import static edu.washington.escience.rivulet.expression.Expressions.field;
import static edu.washington.escience.rivulet.expression.Expressions.greater;
import static edu.washington.escience.rivulet.expression.Expressions.greaterEqual;
import static edu.washington.escience.rivulet.expression.Expressions.less;
import static edu.washington.escience.rivulet.expression.Expressions.lessEqual;
import static edu.washington.escience.rivulet.expression.Expressions.literal;
import static edu.washington.escience.rivulet.expression.Expressions.multiply;
import static edu.washington.escience.rivulet.expression.Expressions.not;
import static edu.washington.escience.rivulet.expression.Expressions.notEqual;
import static edu.washington.escience.rivulet.expression.Expressions.or;
import static edu.washington.escience.rivulet.expression.Expressions.subtract;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import edu.washington.escience.rivulet.DbException;
import edu.washington.escience.rivulet.Schema;
import edu.washington.escience.rivulet.StatusCode;
import edu.washington.escience.rivulet.Type;
import edu.washington.escience.rivulet.column.Column;
import edu.washington.escience.rivulet.storage.TupleBatch;
import edu.washington.escience.rivulet.util.JsonMapperProvider;
import edu.washington.escience.rivulet.util.TestUtils;

public class ExpressionTest {

  private static final Schema SCHEMA =
      Schema.ofFields(
          "i", Type.INT_TYPE, "l", Type.LONG_TYPE, "d", Type.DOUBLE_TYPE, "b", Type.BOOLEAN_TYPE, "s",
          Type.STRING_TYPE);

  private static final TupleBatch BATCH =
      TestUtils.batchFromJson(
          SCHEMA,
          "[[1, 10, 0.5, true, \"alfa\"],"
              + " [null, 20, 1.5, false, \"beta\"],"
              + " [3, null, null, null, null],"
              + " [-4, 40, 2.0, true, \"alfa\"]]");

  private static List<Object> eval(final ExpressionOperator expression) throws DbException {
    Column<?> column = expression.evaluate(BATCH);
    assertEquals(BATCH.numTuples(), column.size());
    List<Object> ret = new ArrayList<>();
    for (int row = 0; row < column.size(); ++row) {
      ret.add(column.getObject(row));
    }
    return ret;
  }

  @Test
  public void testArithmeticTypes() throws DbException {
    assertEquals(Type.INT_TYPE, add(field("i"), literal(1)).getOutputType(SCHEMA));
    assertEquals(Type.LONG_TYPE, add(field("i"), field("l")).getOutputType(SCHEMA));
    assertEquals(Type.DOUBLE_TYPE, multiply(field("l"), field("d")).getOutputType(SCHEMA));
    assertEquals(Type.BOOLEAN_TYPE, less(field("i"), field("d")).getOutputType(SCHEMA));
  }

  @Test
  public void testArithmetic() throws DbException {
    assertEquals(Arrays.asList(2, null, 4, -3), eval(add(field("i"), literal(1))));
    assertEquals(Arrays.asList(9L, null, null, 44L), eval(subtract(field("l"), field("i"))));
    assertEquals(Arrays.asList(5.0, 30.0, null, 80.0), eval(multiply(field("l"), field("d"))));
  }

  @Test
  public void testComparisons() throws DbException {
    assertEquals(Arrays.asList(true, null, null, false), eval(less(field("d"), field("i"))));
    assertEquals(Arrays.asList(false, null, true, false), eval(greater(field("i"), literal(2))));
    assertEquals(Arrays.asList(true, null, true, false), eval(greaterEqual(field("i"), literal(1))));
    assertEquals(Arrays.asList(true, null, false, true), eval(lessEqual(field("i"), literal(1))));
    assertEquals(Arrays.asList(true, false, null, true), eval(equal(field("s"), literal("alfa"))));
    assertEquals(Arrays.asList(false, true, null, false), eval(notEqual(field("s"), literal("alfa"))));
    assertEquals(Arrays.asList(true, null, null, false), eval(equal(field("l"), multiply(field("i"), literal(10L)))));
  }

  @Test
  public void testKleeneLogic() throws DbException {
    ExpressionOperator positive = greater(field("i"), literal(0));
    // b = [true, false, null, true], positive = [true, null, true, false]
    assertEquals(Arrays.asList(true, false, null, false), eval(and(field("b"), positive)));
    assertEquals(Arrays.asList(true, null, true, true), eval(or(field("b"), positive)));
    assertEquals(Arrays.asList(false, true, null, false), eval(not(field("b"))));
    assertEquals(Arrays.asList(false, false, false, false), eval(and(field("b"), literal(false))));
    assertEquals(Arrays.asList(true, true, true, true), eval(or(field("b"), literal(true))));
  }

  @Test
  public void testConstantsStayScalar() throws DbException {
    Column<?> column = add(literal(1), multiply(literal(2), literal(3))).evaluate(BATCH);
    assertTrue(column.isConstant());
    assertEquals(BATCH.numTuples(), column.size());
    assertEquals(7, column.getObject(3));
    assertFalse(add(field("i"), literal(1)).evaluate(BATCH).isConstant());
  }

  @Test
  public void testOverflow() {
    TupleBatch big = TestUtils.batchFromJson(Arrays.asList(Type.INT_TYPE), "[[1], [" + Integer.MAX_VALUE + "]]");
    try {
      add(field("f0"), literal(1)).evaluate(big);
      fail("the sum overflows");
    } catch (DbException e) {
      assertEquals(StatusCode.EXECUTION_ERROR, e.getCode());
    }
    try {
      multiply(literal(Long.MAX_VALUE), literal(2L)).evaluate(big);
      fail("the product overflows");
    } catch (DbException e) {
      assertEquals(StatusCode.EXECUTION_ERROR, e.getCode());
    }
  }

  @Test
  public void testTypeErrors() {
    List<ExpressionOperator> invalid =
        Arrays.asList(
            add(field("s"), literal(1)),
            and(field("b"), field("i")),
            not(field("d")),
            equal(field("s"), field("i")),
            less(field("b"), field("d")),
            field("missing"));
    for (ExpressionOperator expression : invalid) {
      try {
        expression.getOutputType(SCHEMA);
        fail(expression + " should not type check");
      } catch (DbException e) {
        assertEquals(expression.toString(), StatusCode.INVALID, e.getCode());
      }
    }
  }

  @Test
  public void testToString() {
    assertEquals("add(i, 1)", add(field("i"), literal(1)).toString());
    assertEquals("and_kleene(b, invert(or_kleene(b, b)))", and(field("b"), not(or(field("b"), field("b")))).toString());
    assertEquals("equal(s, \"alfa\")", equal(field("s"), literal("alfa")).toString());
    assertEquals("greater_equal(d, 0.5)", greaterEqual(field("d"), literal(0.5)).toString());
  }

  @Test
  public void testJson() throws Exception {
    ExpressionOperator expression =
        and(greater(add(field("i"), literal(3L)), field("d")), not(equal(field("s"), literal("x"))));
    String json = JsonMapperProvider.getWriter().writeValueAsString(expression);
    ExpressionOperator read = JsonMapperProvider.getMapper().readValue(json, ExpressionOperator.class);
    assertEquals(expression, read);
    assertEquals(expression.toString(), read.toString());
    assertEquals(eval(expression), eval(read));
  }

  @Test
  public void testJsonByHand() throws Exception {
    String json =
        "{\"type\": \"GT\", \"left\": {\"type\": \"VARIABLE\", \"columnName\": \"i\"},"
            + " \"right\": {\"type\": \"CONSTANT\", \"valueType\": \"INT_TYPE\", \"value\": \"1\"}}";
    ExpressionOperator read = JsonMapperProvider.getMapper().readValue(json, ExpressionOperator.class);
    assertEquals(greater(field("i"), literal(1)), read);
    assertEquals(Arrays.asList(false, null, true, false), eval(read));
  }
}
