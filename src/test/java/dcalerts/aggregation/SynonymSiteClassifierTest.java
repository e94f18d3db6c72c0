package dcalerts.aggregation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SynonymSiteClassifierTest {
    private SynonymSiteClassifier classifier;

    @BeforeEach
    void setUp() {
        SiteTable table = new SiteTable(
                List.of("Tehran", "Shiraz", "Tabriz", "Mashhad"),
                Map.of(
                        "Tehran", List.of("tehran", "teh"),
                        "Shiraz", List.of("shiraz", "shz"),
                        "Tabriz", List.of("tabriz", "tbz"),
                        "Mashhad", List.of("mashhad")
                ));
        classifier = new SynonymSiteClassifier(table);
    }

    @Test
    void explicitLabelMatchesCaseInsensitively() {
        RawAlert alert = RawAlert.builder().labels(Map.of("DC", "mAsHhAd")).build();

        assertThat(classifier.classify(alert)).containsExactly("Mashhad");
    }

    @Test
    void synonymInAnnotationText() {
        RawAlert alert = RawAlert.builder()
                .annotations(Map.of("summary", "Link down at SHZ core switch"))
                .build();

        assertThat(classifier.classify(alert)).containsExactly("Shiraz");
    }

    @Test
    void twoSitesInDescriptionYieldBoth() {
        RawAlert alert = RawAlert.builder()
                .annotations(Map.of("description", "replication from tehran to tabriz lagging"))
                .build();

        assertThat(classifier.classify(alert)).containsExactly("Tehran", "Tabriz");
    }

    @Test
    void explicitLabelAndTextAreUnioned() {
        RawAlert alert = RawAlert.builder()
                .labels(Map.of("dc", "Shiraz"))
                .annotations(Map.of("body", "failover target: mashhad"))
                .build();

        assertThat(classifier.classify(alert)).containsExactlyInAnyOrder("Shiraz", "Mashhad");
    }

    @Test
    void siteLabelValueIsAlsoSearchedForSynonyms() {
        RawAlert alert = RawAlert.builder().labels(Map.of("dc", "teh-dc-02")).build();

        assertThat(classifier.classify(alert)).containsExactly("Tehran");
    }

    @Test
    void otherLabelsAndAnnotationsAreIgnored() {
        RawAlert alert = RawAlert.builder()
                .labels(Map.of("instance", "tehran-db-1"))
                .annotations(Map.of("runbook", "see shiraz wiki"))
                .build();

        assertThat(classifier.classify(alert)).isEmpty();
    }

    @Test
    void noMatchGivesEmptySet() {
        RawAlert alert = RawAlert.builder()
                .labels(Map.of("alertname", "Watchdog"))
                .annotations(Map.of("summary", "always firing"))
                .build();

        assertThat(classifier.classify(alert)).isEmpty();
    }

    @Test
    void missingMapsAreTolerated() {
        RawAlert alert = RawAlert.builder().labels(null).annotations(null).build();

        assertThat(classifier.classify(alert)).isEmpty();
    }

    @Test
    void customSiteLabelName() {
        SiteTable table = new SiteTable(List.of("Tehran"), Map.of("Tehran", List.of("thr")));
        SynonymSiteClassifier byRegion = new SynonymSiteClassifier(table, "region");

        assertThat(byRegion.classify(RawAlert.builder().labels(Map.of("Region", "tehran")).build()))
                .containsExactly("Tehran");
        assertThat(byRegion.classify(RawAlert.builder().labels(Map.of("dc", "tehran")).build()))
                .isEmpty();
    }
}
