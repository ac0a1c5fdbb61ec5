package com.advotac.assistant.rag.layer;

import static org.assertj.core.api.Assertions.assertThat;

import com.advotac.assistant.model.Hit;
import com.advotac.assistant.model.HitMetadata;
import com.advotac.assistant.model.Layer;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LayerClassifierTest {
    private final LayerClassifier classifier = new LayerClassifier();

    @Test
    void explicitTierWins() {
        HitMetadata meta = meta("302", null, "(1) text with clause", "L1");
        assertThat(classifier.classify(meta, "advotac_acts_L3")).isEqualTo(Layer.L1);
    }

    @Test
    void collectionSuffixBeatsStructure() {
        HitMetadata meta = meta("302", null, "plain text", null);
        assertThat(classifier.classify(meta, "advotac_acts_L3")).isEqualTo(Layer.L3);
        assertThat(classifier.classify(meta, "advotac_acts_l1")).isEqualTo(Layer.L1);
    }

    @Test
    void invalidTierFallsThrough() {
        HitMetadata meta = meta("302", null, "plain text", "chapter");
        assertThat(classifier.classify(meta, "central_acts_v2")).isEqualTo(Layer.L2);
    }

    @Test
    void laterValidTierKeyIsUsedWhenEarlierOneIsNotATier() {
        HitMetadata meta = HitMetadata.fromPayload(Map.of("layer", "chapter", "level", "L3", "section_number", "5"));
        assertThat(classifier.classify(meta, "central_acts_v2")).isEqualTo(Layer.L3);
    }

    @Test
    void clauseFieldOrTextMarkerMeansL3() {
        assertThat(classifier.classify(meta("10", "(a)", "text", null), "central_acts_v2")).isEqualTo(Layer.L3);
        assertThat(classifier.classify(meta("10", null, "(2) Every such notice shall", null), "central_acts_v2"))
                .isEqualTo(Layer.L3);
        assertThat(classifier.classify(meta(null, null, "as provided in clause (iv)", null), "central_acts_v2"))
                .isEqualTo(Layer.L3);
    }

    @Test
    void sectionNumberMeansL2OtherwiseL1() {
        assertThat(classifier.classify(meta("420", null, "Cheating and dishonestly inducing", null), "central_acts_v2"))
                .isEqualTo(Layer.L2);
        assertThat(classifier.classify(meta(null, null, "CHAPTER XVII OF OFFENCES AGAINST PROPERTY", null), "central_acts_v2"))
                .isEqualTo(Layer.L1);
        assertThat(classifier.classify(new Hit(0.5, "central_acts_v2", null))).isEqualTo(Layer.L1);
    }

    @Test
    void suffixParsing() {
        assertThat(LayerClassifier.fromCollectionSuffix("acts_L2")).contains(Layer.L2);
        assertThat(LayerClassifier.fromCollectionSuffix("central_acts_v2")).isEmpty();
        assertThat(LayerClassifier.fromCollectionSuffix("")).isEmpty();
    }

    private static HitMetadata meta(String section, String clause, String text, String tier) {
        return new HitMetadata("The Indian Penal Code, 1860", section, null, null, null, clause, null, text, tier, Map.of());
    }
}
