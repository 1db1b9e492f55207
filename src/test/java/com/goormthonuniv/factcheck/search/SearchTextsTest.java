package com.goormthonuniv.factcheck.search;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SearchTextsTest {

    @Test
    void stripsTagsAndUnescapesEntities() {
        assertThat(SearchTexts.clean("<b>Company X</b> &amp; Product&nbsp;Y &quot;launch&quot;"))
                .isEqualTo("Company X & Product Y \"launch\"");
        assertThat(SearchTexts.clean(null)).isEmpty();
    }
}
