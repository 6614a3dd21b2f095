package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment;

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Doubles;
import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.ExperimentProperties;
import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.Quantity;
import edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment.config.ParserConfig;
import edu.harvard.hms.dbmi.avillach.kinetics.exception.ExperimentFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the measured columns of every {@code dataGroup} in a document. Values of the same series are appended across
 * groups in document order, so a one-row group of conditions and a many-row volume history can sit side by side without
 * their row counts having to agree.
 */
public class DataSeriesExtractor {

    private static final Logger log = LoggerFactory.getLogger(DataSeriesExtractor.class);

    private final Map<String, SeriesKey> columnAliases;

    public DataSeriesExtractor() {
        this.columnAliases = ImmutableMap.of();
    }

    public DataSeriesExtractor(ParserConfig config) {
        ImmutableMap.Builder<String, SeriesKey> aliases = ImmutableMap.builder();
        config.getColumn_aliases().forEach(
            (column, series) -> aliases.put(
                column,
                SeriesKey.fromColumnName(series)
                    .orElseThrow(() -> new IllegalArgumentException("Column alias " + column + " points at unknown series " + series))
            )
        );
        this.columnAliases = aliases.build();
    }

    /**
     * Adds every recognised series to {@code properties}. A series holding a single value across the whole document is
     * stored as a scalar quantity. Rows are kept in document order and are not checked for increasing time.
     */
    public ExperimentProperties extract(ExperimentProperties properties, Element root) {
        Map<SeriesKey, Series> collected = new EnumMap<>(SeriesKey.class);

        List<Element> dataGroups = XmlElementUtil.children(root, "dataGroup");
        for (int groupIndex = 0; groupIndex < dataGroups.size(); groupIndex++) {
            Element dataGroup = dataGroups.get(groupIndex);
            String groupId = XmlElementUtil.attribute(dataGroup, "id").orElse("#" + (groupIndex + 1));
            Map<String, SeriesKey> columns = readColumns(dataGroup, groupId, collected);

            int rowNumber = 0;
            for (Element dataPoint : XmlElementUtil.children(dataGroup, "dataPoint")) {
                rowNumber++;
                for (Map.Entry<String, SeriesKey> column : columns.entrySet()) {
                    collected.get(column.getValue()).values.add(parseCell(dataPoint, column.getKey(), groupId, rowNumber));
                }
            }
            log.debug("Read {} rows of {} from data group {}", rowNumber, columns.values(), groupId);
        }

        for (Map.Entry<SeriesKey, Series> entry : collected.entrySet()) {
            Series series = entry.getValue();
            if (series.values.isEmpty()) {
                log.debug("Series {} is declared but has no rows", entry.getKey().getColumnName());
                continue;
            }
            entry.getKey().applyTo(properties, Quantity.ofSeries(Doubles.toArray(series.values), series.units));
        }
        return properties;
    }

    /**
     * @return column id to series for the recognised columns of one data group, in declaration order
     */
    private Map<String, SeriesKey> readColumns(Element dataGroup, String groupId, Map<SeriesKey, Series> collected) {
        Map<String, SeriesKey> columns = new LinkedHashMap<>();
        for (Element property : XmlElementUtil.children(dataGroup, "property")) {
            String name = XmlElementUtil.attribute(property, "name").orElse("");
            Optional<SeriesKey> key = SeriesKey.fromColumnName(name).or(() -> Optional.ofNullable(columnAliases.get(name)));
            if (key.isEmpty()) {
                log.debug("Ignoring column \"{}\" of data group {}", name, groupId);
                continue;
            }

            String id = XmlElementUtil.attribute(property, "id")
                .orElseThrow(() -> new ExperimentFormatException("Column \"" + name + "\" of data group " + groupId + " has no id"));
            String units = XmlElementUtil.attribute(property, "units")
                .orElseThrow(() -> new ExperimentFormatException("Column \"" + name + "\" of data group " + groupId + " has no units"));

            Series series = collected.computeIfAbsent(key.get(), k -> new Series(units));
            if (!series.units.equals(units)) {
                throw new ExperimentFormatException(
                    "Series \"" + key.get().getColumnName() + "\" is given in both " + series.units + " and " + units
                        + " (data group " + groupId + ")"
                );
            }
            // a second column for the same series would double every row of the group
            if (columns.containsValue(key.get())) {
                throw new ExperimentFormatException(
                    "Data group " + groupId + " has more than one column for series \"" + key.get().getColumnName() + "\" (column \""
                        + name + "\")"
                );
            }
            columns.put(id, key.get());
        }
        return columns;
    }

    private double parseCell(Element dataPoint, String columnId, String groupId, int rowNumber) {
        String value = XmlElementUtil.childText(dataPoint, columnId).orElseThrow(
            () -> new ExperimentFormatException(
                "Exception parsing data group " + groupId + " on row " + rowNumber + ", column " + columnId + ". Value is missing"
            )
        );
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ExperimentFormatException(
                "Exception parsing data group " + groupId + " on row " + rowNumber + ", column " + columnId + ". Value = \"" + value
                    + "\"",
                e
            );
        }
    }

    private static final class Series {
        private final String units;
        private final List<Double> values = new ArrayList<>();

        private Series(String units) {
            this.units = units;
        }
    }
}
