package com.delta.adfeed.monitor.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class XmlTextUtilsTest {

    @Test
    void keepsPrintableTextAndSupplementaryCharacters() {
        String text = "Sofa 🛋️\tcheap\n";

        assertThat(XmlTextUtils.stripIllegalXmlChars(text)).isSameAs(text);
    }

    @Test
    void dropsControlCharactersAndLoneSurrogates() {
        assertThat(XmlTextUtils.stripIllegalXmlChars("Bad\u0008 ch\u0000air\uD800")).isEqualTo("Bad chair");
    }

    @Test
    void passesNullThrough() {
        assertThat(XmlTextUtils.stripIllegalXmlChars(null)).isNull();
    }
}
