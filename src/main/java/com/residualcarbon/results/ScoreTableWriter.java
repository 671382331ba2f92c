package com.residualcarbon.results;

import com.csvreader.CsvWriter;
import com.google.common.base.Joiner;
import com.residualcarbon.analysis.models.SoilProperty;
import com.residualcarbon.scoring.SuitabilityScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes one row per scored hex: both score scales, the quality index, grade, each property's value and sub-score,
 * and any degradation flags.
 */
public class ScoreTableWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ScoreTableWriter.class);

    public void writeCsv (List<SuitabilityScore> scores, File file) throws IOException {
        List<String> header = new ArrayList<>();
        header.add("cell_id");
        header.add("suitability_score");
        header.add("suitability_score_10");
        header.add("soil_quality_index");
        header.add("grade");
        for (SoilProperty property : SoilProperty.values()) {
            header.add(property.key);
            header.add(property.key + "_score");
        }
        header.add("point_count");
        header.add("flags");
        header.add("recommendation");

        try (Writer writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8))) {
            CsvWriter csv = new CsvWriter(writer, ',');
            csv.writeRecord(header.toArray(new String[0]));
            for (SuitabilityScore score : scores) {
                List<String> row = new ArrayList<>(header.size());
                row.add(score.address);
                row.add(String.format(Locale.ROOT, "%.2f", score.compositeScore));
                row.add(String.format(Locale.ROOT, "%.3f", score.rescaledScore));
                row.add(String.format(Locale.ROOT, "%.2f", score.qualityIndex));
                row.add(score.grade.label);
                for (SoilProperty property : SoilProperty.values()) {
                    row.add(String.format(Locale.ROOT, "%.4f", score.values.get(property)));
                    row.add(String.valueOf(score.subscores.get(property)));
                }
                row.add(String.valueOf(score.pointCount));
                row.add(Joiner.on('|').join(score.flags));
                row.add(score.grade.recommendation);
                csv.writeRecord(row.toArray(new String[0]));
            }
            csv.flush();
        }
        LOG.info("Wrote {} scores to {}", scores.size(), file);
    }
}
