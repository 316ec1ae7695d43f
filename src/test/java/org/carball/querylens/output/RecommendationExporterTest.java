package org.carball.querylens.output;

import org.carball.querylens.model.recommendation.Recommendation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class RecommendationExporterTest {

    @Test
    void shouldExportPendingRecommendationsAsSqlScript() {
        // Given
        Recommendation pending = recommendation("Add index on ORDERS(CUSTOMER_ID)",
                "CREATE INDEX idx_ORDERS_CUSTOMER_ID ON ORDERS (CUSTOMER_ID);");
        Recommendation dismissed = recommendation("Add index on USERS(EMAIL)",
                "CREATE INDEX idx_USERS_EMAIL ON USERS (EMAIL);");
        dismissed.dismiss();
        Recommendation second = recommendation("Add index on ITEMS(SKU)",
                "CREATE INDEX idx_ITEMS_SKU ON ITEMS (SKU);");

        // When
        String script = new RecommendationExporter(List.of(pending, dismissed, second)).toSqlScript();

        // Then
        String[] lines = script.split("\n", -1);
        assertThat(lines[0]).startsWith("-- Add index on ORDERS(CUSTOMER_ID) (impact score: ");
        assertThat(lines[1]).isEqualTo("CREATE INDEX idx_ORDERS_CUSTOMER_ID ON ORDERS (CUSTOMER_ID);");
        assertThat(lines[2]).isEmpty();
        assertThat(lines[3]).startsWith("-- Add index on ITEMS(SKU)");
        assertThat(lines[4]).isEqualTo("CREATE INDEX idx_ITEMS_SKU ON ITEMS (SKU);");
        assertThat(script).doesNotContain("USERS");
    }

    @Test
    void shouldReturnEmptyScriptWhenNothingIsPending() {
        // Given
        Recommendation implemented = recommendation("Add index on T(X)", "CREATE INDEX idx_T_X ON T (X);");
        implemented.implement();

        // When / Then
        assertThat(new RecommendationExporter(List.of(implemented)).toSqlScript()).isEmpty();
    }

    @Test
    void shouldRenderMarkdownSummary() {
        // Given
        Recommendation rec = recommendation("Add index on T(X)", "CREATE INDEX idx_T_X ON T (X);");
        rec.schedule();

        // When
        String markdown = new RecommendationExporter(List.of(rec)).toMarkdown();

        // Then
        assertThat(markdown).startsWith("# Index Recommendations\n\n");
        assertThat(markdown).contains("## Add index on T(X)");
        assertThat(markdown).contains("- **Type:** index");
        assertThat(markdown).contains("- **Status:** scheduled");
        assertThat(markdown).contains("- **Related Objects:** T");
        assertThat(markdown).contains("Index helps lookups");
        assertThat(markdown).contains("```sql\nCREATE INDEX idx_T_X ON T (X);\n```");
    }

    @Test
    void shouldSayWhenThereAreNoRecommendations() {
        assertThat(new RecommendationExporter(List.of()).toMarkdown())
                .contains("No index recommendations were generated");
    }

    private static Recommendation recommendation(String title, String script) {
        return Recommendation.builder()
                .recommendationId(title)
                .title(title)
                .description("Index helps lookups")
                .impactScore(12.5)
                .sqlScript(script)
                .relatedObjects(List.of("T"))
                .build();
    }
}
