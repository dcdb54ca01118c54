package co.strata.core.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class KeyTemplateTest {

  @Test
  void parsesLiteralsAndPlaceholders() {
    KeyTemplate t = KeyTemplate.parse("TENANT#{0}#CUST#{1}");

    assertThat(t.maxIndex()).isEqualTo(1);
    assertThat(t.segments()).hasSize(4);
    assertThat(t.segments().get(0).literal()).isEqualTo("TENANT#");
    assertThat(t.segments().get(1).isPlaceholder()).isTrue();
    assertThat(t.segments().get(1).index()).isZero();
    assertThat(t.render((i, fmt) -> i == 0 ? "t1" : "c9")).isEqualTo("TENANT#t1#CUST#c9");
  }

  @Test
  void keepsPlaceholderFormat() {
    KeyTemplate t = KeyTemplate.parse("{0}#{1:yyyy-MM}");

    assertThat(t.segments().get(2).format()).isEqualTo("yyyy-MM");
    assertThat(t.render((i, fmt) -> i + "/" + fmt)).isEqualTo("0/null#1/yyyy-MM");
  }

  @Test
  void placeholdersMayRepeatAndSkip() {
    KeyTemplate t = KeyTemplate.parse("{2}-{2}");

    assertThat(t.maxIndex()).isEqualTo(2);
    assertThat(t.render((i, fmt) -> "x")).isEqualTo("x-x");
  }

  @Test
  void escapesBraces() {
    KeyTemplate t = KeyTemplate.parse("{{{0}}}");

    assertThat(t.render((i, fmt) -> "v")).isEqualTo("{v}");
  }

  @Test
  void templateWithoutPlaceholders() {
    KeyTemplate t = KeyTemplate.parse("META");

    assertThat(t.maxIndex()).isEqualTo(-1);
    assertThat(t.render((i, fmt) -> fail("no placeholders expected"))).isEqualTo("META");
  }

  @Test
  void rejectsMalformedTemplates() {
    assertThatThrownBy(() -> KeyTemplate.parse("A#{0")).isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unmatched '{'");
    assertThatThrownBy(() -> KeyTemplate.parse("A}#{0}")).isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unmatched '}'");
    assertThatThrownBy(() -> KeyTemplate.parse("{x}")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> KeyTemplate.parse("{-1}")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> KeyTemplate.parse("")).isInstanceOf(IllegalArgumentException.class);
  }
}
