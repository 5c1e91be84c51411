package io.jafar.hprof.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ClassNameUtilTest {

  @ParameterizedTest
  @CsvSource({
    "java/lang/String, java.lang.String",
    "java/util/HashMap$Node, java.util.HashMap$Node",
    "[I, int[]",
    "[[J, long[][]",
    "[Z, boolean[]",
    "[Ljava/lang/Object;, java.lang.Object[]",
    "[[Ljava/lang/String;, java.lang.String[][]",
    "java.lang.Object[], java.lang.Object[]",
    "Foo, Foo"
  })
  void convertsToJavaSourceForm(String internal, String expected) {
    assertEquals(expected, ClassNameUtil.toJavaName(internal));
  }

  @ParameterizedTest
  @CsvSource({"java/lang/String, java.lang.String", "Foo, Foo"})
  void qualifiesInternalNames(String internal, String expected) {
    assertEquals(expected, ClassNameUtil.toQualified(internal));
  }

  @Test
  void nullStaysNull() {
    assertNull(ClassNameUtil.toJavaName(null));
    assertNull(ClassNameUtil.toQualified(null));
  }
}
