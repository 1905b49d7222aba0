package io.github.wphillipmoore.http.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QueryNormalizerTest {

  @Nested
  class Normalize {

    @Test
    void urlWithoutQueryIsUnchanged() {
      assertThat(QueryNormalizer.normalize("http://host/path")).isEqualTo("http://host/path");
    }

    @Test
    void sortsKeys() {
      assertThat(QueryNormalizer.normalize("http://host/p?b=2&a=1&c=3"))
          .isEqualTo("http://host/p?a=1&b=2&c=3");
    }

    @Test
    void keepsValueOrderWithinKey() {
      assertThat(QueryNormalizer.normalize("http://host/p?x=2&a=0&x=1"))
          .isEqualTo("http://host/p?a=0&x=2&x=1");
    }

    @Test
    void reEscapesValues() {
      assertThat(QueryNormalizer.normalize("http://host/p?q=hello world&r=a%2Fb&s=x+y"))
          .isEqualTo("http://host/p?q=hello+world&r=a%2Fb&s=x+y");
    }

    @Test
    void escapesReservedCharactersConsistently() {
      assertThat(QueryNormalizer.normalize("http://host/p?v=a*b~c:d"))
          .isEqualTo("http://host/p?v=a%2Ab~c%3Ad");
    }

    @Test
    void keyWithoutValueGetsEmptyValue() {
      assertThat(QueryNormalizer.normalize("http://host/p?flag&a=1"))
          .isEqualTo("http://host/p?a=1&flag=");
    }

    @Test
    void keepsFragment() {
      assertThat(QueryNormalizer.normalize("http://host/p?b=1&a=2#section"))
          .isEqualTo("http://host/p?a=2&b=1#section");
    }

    @Test
    void questionMarkInsideFragmentIsNotAQuery() {
      assertThat(QueryNormalizer.normalize("http://host/p#frag?x=1"))
          .isEqualTo("http://host/p#frag?x=1");
    }

    @Test
    void emptyQueryIsDropped() {
      assertThat(QueryNormalizer.normalize("http://host/p?")).isEqualTo("http://host/p");
    }

    @Test
    void dropsPairsWithSemicolons() {
      assertThat(QueryNormalizer.normalize("http://host/p?a=1;b=2&c=3"))
          .isEqualTo("http://host/p?c=3");
    }

    @Test
    void dropsPairsWithInvalidEscapes() {
      assertThat(QueryNormalizer.normalize("http://host/p?a=%zz&b=ok"))
          .isEqualTo("http://host/p?b=ok");
    }

    @Test
    void keepsEscapesThatAreNotUtf8() {
      assertThat(QueryNormalizer.normalize("http://h/p?q=caf%E9"))
          .isEqualTo("http://h/p?q=caf%E9");
    }

    @Test
    void sortsKeysByUtf8Bytes() {
      // U+FF5E sorts after U+1F600 in UTF-16 but before it in UTF-8.
      assertThat(QueryNormalizer.normalize("http://h/p?%F0%9F%98%80=1&%EF%BD%9E=2"))
          .isEqualTo("http://h/p?%EF%BD%9E=2&%F0%9F%98%80=1");
    }

    @Test
    void reEncodesLiteralNonAsciiAsUtf8() {
      assertThat(QueryNormalizer.normalize("http://h/p?q=caf\u00e9"))
          .isEqualTo("http://h/p?q=caf%C3%A9");
    }

    @Test
    void dropsPairsWithTruncatedEscapes() {
      assertThat(QueryNormalizer.normalize("http://h/p?a=%4&b=1"))
          .isEqualTo("http://h/p?b=1");
    }

    @Test
    void controlCharacterIsRejected() {
      assertThatThrownBy(() -> QueryNormalizer.normalize("http://host/p?a=1\n"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("control character");
    }
  }

  @Nested
  class ParseAndEncode {

    @Test
    void parseDecodesPlusAsSpace() {
      Map<String, List<String>> params = QueryNormalizer.parse("name=John+Smith");

      assertThat(params).containsEntry("name", List.of("John Smith"));
    }

    @Test
    void parseSkipsEmptyPairs() {
      Map<String, List<String>> params = QueryNormalizer.parse("&&a=1&");

      assertThat(params).containsOnlyKeys("a");
    }

    @Test
    void parseKeepsRawBytes() {
      Map<String, List<String>> params = QueryNormalizer.parse("q=%E9%FF");

      assertThat(params.get("q").get(0).getBytes(StandardCharsets.ISO_8859_1))
          .containsExactly(0xE9, 0xFF);
    }

    @Test
    void unescapeRejectsBadEscape() {
      assertThat(QueryNormalizer.unescape("a%G1")).isNull();
    }

    @Test
    void escapeLeavesUnreservedCharactersLiteral() {
      assertThat(QueryNormalizer.escape("AZaz09-_.~".getBytes(StandardCharsets.US_ASCII)))
          .isEqualTo("AZaz09-_.~");
    }

    @Test
    void escapeUsesUpperCaseHexAndPlusForSpace() {
      assertThat(QueryNormalizer.escape("é a/".getBytes(StandardCharsets.UTF_8)))
          .isEqualTo("%C3%A9+a%2F");
    }
  }
}
