package com.wxdb.observation.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.wxdb.observation.AbstractPostgresContainerTest;
import com.wxdb.observation.model.StationMetadataRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class StationMetadataRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private StationMetadataRepository metadataRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM tbl_metadata", new MapSqlParameterSource());
  }

  @Test
  void upsertReplacesExistingStation() {
    metadataRepository.upsert(station("Tuolumne Meadows", "2621", BASE_TIME));
    metadataRepository.upsert(station("Tuolumne Meadows RS", "2622", BASE_TIME.plusSeconds(60)));

    final Optional<StationMetadataRecord> stored = metadataRepository.findByPrimaryId("TUM");

    assertThat(stored).isPresent();
    assertThat(stored.get().stationName()).isEqualTo("Tuolumne Meadows RS");
    assertThat(stored.get().elevation()).isEqualByComparingTo("2622");
    assertThat(stored.get().updatedAt()).isEqualTo(BASE_TIME.plusSeconds(60));
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM tbl_metadata", new MapSqlParameterSource(), Integer.class);
    assertThat(count).isEqualTo(1);
  }

  private StationMetadataRecord station(String name, String elevation, Instant updatedAt) {
    return new StationMetadataRecord(
        "TUM",
        name,
        new BigDecimal("37.873"),
        new BigDecimal("-119.35"),
        new BigDecimal(elevation),
        "US National Park Service",
        new BigDecimal("37.873"),
        new BigDecimal("-119.35"),
        "cdec",
        "CA",
        "PDT",
        updatedAt);
  }
}
