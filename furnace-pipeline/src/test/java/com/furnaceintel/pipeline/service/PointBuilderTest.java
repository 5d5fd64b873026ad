package com.furnaceintel.pipeline.service;

import com.furnaceintel.pipeline.model.MappingTable;
import com.furnaceintel.pipeline.model.Point;
import com.furnaceintel.pipeline.model.RawRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class PointBuilderTest {

    private static final Instant TS = Instant.parse("2025-05-29T06:30:00Z");

    private final PointBuilder builder = new PointBuilder(new FieldClassifier(List.of(
            new MappingTable("TEMP PARAMS MAP", "temperature_profile",
                    Map.of("BF2_TOP_GAS_TEMP_1", "top_gas_temp_1", "BF2_TOP_GAS_TEMP_2", "top_gas_temp_2")),
            new MappingTable("PROCESS PARAMS MAP", "process_params",
                    Map.of("BF2_HOT_BLAST_TEMP", "hot_blast_temp", "BF2_HOT_BLAST_TEMP_SPARE", "hot_blast_temp_spare")),
            new MappingTable("COOLING WATER MAP", "cooling_water",
                    Map.of("BF2_CW_SUPPLY_FLOW", "supply_flow"))),
            Set.of("hot_blast_temp_spare")));

    private static RawRecord record(Object... pairs) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            values.put((String) pairs[i], pairs[i + 1]);
        }
        return RawRecord.of(values);
    }

    @Test
    void shouldGroupFieldsByMeasurementInFirstSeenOrder() {
        RawRecord r = record(
                "Timelogged", "05/29/2025 12:00:00 PM",
                "BF2_HOT_BLAST_TEMP", 1150.5,
                "BF2_TOP_GAS_TEMP_2", "130",
                "BF2_TOP_GAS_TEMP_1", 128L);

        List<Point> points = builder.build(r, TS);

        assertThat(points).extracting(Point::measurement).containsExactly("process_params", "temperature_profile");
        assertThat(points.get(1).fields()).containsExactly(entry("top_gas_temp_2", 130.0), entry("top_gas_temp_1", 128.0));
        assertThat(points).allSatisfy(p -> assertThat(p.epochSeconds()).isEqualTo(TS.getEpochSecond()));
    }

    @Test
    void shouldBeDeterministic() {
        RawRecord r = record("BF2_TOP_GAS_TEMP_1", "128.4", "BF2_CW_SUPPLY_FLOW", 42L, "BF2_HOT_BLAST_TEMP", 1150);

        List<String> first = builder.build(r, TS).stream().map(Point::toLineProtocol).toList();
        List<String> second = builder.build(r, TS).stream().map(Point::toLineProtocol).toList();

        assertThat(first).isEqualTo(second);
        assertThat(first).containsExactly(
                "temperature_profile top_gas_temp_1=128.4 1748500200",
                "cooling_water supply_flow=42.0 1748500200",
                "process_params hot_blast_temp=1150.0 1748500200");
    }

    @Test
    void shouldSuppressMeasurementWhoseValuesAllFailCoercion() {
        RawRecord r = record("BF2_TOP_GAS_TEMP_1", "", "BF2_TOP_GAS_TEMP_2", "bad", "BF2_CW_SUPPLY_FLOW", 3.0);

        List<Point> points = builder.build(r, TS);

        assertThat(points).extracting(Point::measurement).containsExactly("cooling_water");
    }

    @Test
    void shouldDropForcedStringFields() {
        RawRecord r = record("BF2_HOT_BLAST_TEMP_SPARE", "1200", "BF2_HOT_BLAST_TEMP", 1150.0);

        List<Point> points = builder.build(r, TS);

        assertThat(points).hasSize(1);
        assertThat(points.get(0).fields()).containsOnlyKeys("hot_blast_temp");
    }

    @Test
    void shouldIgnoreUnknownAndTimestampFields() {
        RawRecord r = record("Timelogged", "05/29/2025 12:00:00 PM", "SOMETHING_ELSE", 5L, "BF2_TOP_GAS_TEMP_1", null);

        assertThat(builder.build(r, TS)).isEmpty();
    }
}
