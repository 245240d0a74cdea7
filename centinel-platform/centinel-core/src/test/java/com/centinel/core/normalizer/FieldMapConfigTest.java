package com.centinel.core.normalizer;

import com.centinel.core.config.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class FieldMapConfigTest {

    @Test
    void fromJson_mergesPartialTotalsWithDefaults() {
        FieldMapConfig config = CanonicalJson.read("""
                {"totals": {"valid_votes": ["x.validos"]}, "candidate_roots": ["r"]}
                """, FieldMapConfig.class);

        assertThat(config.totalsPaths(FieldMapConfig.VALID_VOTES)).containsExactly("x.validos");
        assertThat(config.totalsPaths(FieldMapConfig.TOTAL_VOTES))
                .isEqualTo(FieldMapConfig.defaults().totalsPaths(FieldMapConfig.TOTAL_VOTES));
        assertThat(config.candidateRoots()).containsExactly("r");
        assertThat(config.candidateFields()).isEqualTo(FieldMapConfig.CandidateFieldPaths.defaults());
    }

    @Test
    void validate_acceptsBuiltInMaps() {
        assertThatCode(() -> FieldMapConfig.defaults().validate()).doesNotThrowAnyException();
        assertThatCode(() -> FieldMapConfig.identity().validate()).doesNotThrowAnyException();
    }

    @Test
    void validate_rejectsMalformedPath() {
        FieldMapConfig config = CanonicalJson.read("""
                {"timestamp": ["meta..fecha"]}
                """, FieldMapConfig.class);

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("meta..fecha");
    }

    @Test
    void validate_rejectsEmptyVotesPaths() {
        FieldMapConfig config = CanonicalJson.read("""
                {"candidate_fields": {"votes": []}}
                """, FieldMapConfig.class);

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("votes");
    }

    @Test
    void validate_rejectsUnknownTotalsField() {
        Map<String, List<String>> totals = new HashMap<>(FieldMapConfig.defaults().totals());
        totals.put("spoiled_votes", List.of("anulados"));
        FieldMapConfig base = FieldMapConfig.defaults();
        FieldMapConfig config = new FieldMapConfig(totals, base.candidateRoots(), base.candidateFields(),
                base.timestamp(), base.electionLevel(), base.geographyCode(), base.geographyName(),
                base.processedUnits(), base.totalUnits(), base.metadata(), base.metadataRoot(),
                base.defaultElectionLevel());

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("spoiled_votes");
    }
}
