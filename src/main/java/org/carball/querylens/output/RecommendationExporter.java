package org.carball.querylens.output;

import org.carball.querylens.model.recommendation.Recommendation;

import java.util.List;

/**
 * Renders recommendations as an executable SQL script or a Markdown summary.
 */
public class RecommendationExporter {

    private final List<Recommendation> recommendations;

    public RecommendationExporter(List<Recommendation> recommendations) {
        this.recommendations = recommendations;
    }

    /**
     * Returns the scripts of all pending recommendations, each preceded by a comment line.
     */
    public String toSqlScript() {
        StringBuilder sql = new StringBuilder();

        for (Recommendation rec : recommendations) {
            if (!rec.isPending() || rec.getSqlScript() == null || rec.getSqlScript().isBlank()) {
                continue;
            }
            if (sql.length() > 0) {
                sql.append("\n");
            }
            sql.append("-- ").append(rec.getTitle())
                    .append(String.format(" (impact score: %.2f)", rec.getImpactScore())).append("\n");
            sql.append(rec.getSqlScript()).append("\n");
        }

        return sql.toString();
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        md.append("# Index Recommendations\n\n");

        if (recommendations.isEmpty()) {
            md.append("**No index recommendations were generated.**\n");
            return md.toString();
        }

        for (Recommendation rec : recommendations) {
            md.append("## ").append(rec.getTitle()).append("\n\n");
            md.append("- **Type:** ").append(rec.getType().getValue()).append("\n");
            md.append("- **Impact Score:** ").append(String.format("%.2f", rec.getImpactScore())).append("\n");
            md.append("- **Status:** ").append(rec.getStatus().getValue()).append("\n");
            md.append("- **Related Objects:** ").append(String.join(", ", rec.getRelatedObjects())).append("\n");
            if (rec.getEstimatedImprovement() != null) {
                md.append("- **Estimated Improvement:** ").append(rec.getEstimatedImprovement()).append("\n");
            }
            md.append("\n");

            md.append(rec.getDescription()).append("\n\n");

            if (rec.getSqlScript() != null) {
                md.append("```sql\n").append(rec.getSqlScript()).append("\n```\n\n");
            }
        }

        return md.toString();
    }
}
