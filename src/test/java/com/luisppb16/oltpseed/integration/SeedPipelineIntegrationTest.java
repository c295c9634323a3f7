/*
 *  Copyright (c) 2025 Luis Pepe (@LuisPPB16).
 *  All rights reserved.
 */

package com.luisppb16.oltpseed.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.luisppb16.oltpseed.Fixtures;
import com.luisppb16.oltpseed.config.GenerationConfig;
import com.luisppb16.oltpseed.db.generator.assembler.TableAssemblerRegistry;
import com.luisppb16.oltpseed.service.SeedPipeline;
import com.luisppb16.oltpseed.service.SeedReport;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Seeds a small hotel schema in H2 end to end. */
class SeedPipelineIntegrationTest {

  private static final String URL = "jdbc:h2:mem:pipeline";

  private static final Map<String, Integer> COUNTS =
      Map.of(
          "hotel", 3,
          "room", 12,
          "customer", 20,
          "booking", 30,
          "booking_room", 40,
          "invoice", 25);

  @TempDir Path outDir;

  private Connection conn;

  @BeforeEach
  void setUp() throws SQLException {
    conn = DriverManager.getConnection(URL, "sa", "");
    try (Statement st = conn.createStatement()) {
      st.execute(
          "CREATE TABLE hotel (hotel_id INT PRIMARY KEY, name VARCHAR(120) NOT NULL, "
              + "city VARCHAR(60), country VARCHAR(60), postal_code VARCHAR(12))");
      st.execute(
          "CREATE TABLE room (room_id INT PRIMARY KEY, "
              + "hotel_id INT NOT NULL REFERENCES hotel(hotel_id), "
              + "room_number VARCHAR(10), floor INT, base_rate DECIMAL(10,2))");
      st.execute(
          "CREATE TABLE customer (customer_id INT PRIMARY KEY, first_name VARCHAR(60), "
              + "last_name VARCHAR(60), email VARCHAR(120) NOT NULL UNIQUE, phone VARCHAR(30))");
      st.execute(
          "CREATE TABLE booking (booking_id INT PRIMARY KEY, "
              + "customer_id INT NOT NULL REFERENCES customer(customer_id), "
              + "hotel_id INT NOT NULL REFERENCES hotel(hotel_id), "
              + "checkin_date DATE NOT NULL, checkout_date DATE NOT NULL, "
              + "total_amount DECIMAL(10,2), status VARCHAR(20), "
              + "created_at TIMESTAMP WITH TIME ZONE)");
      st.execute(
          "CREATE TABLE booking_room ("
              + "booking_id INT NOT NULL REFERENCES booking(booking_id), "
              + "room_id INT NOT NULL REFERENCES room(room_id), "
              + "PRIMARY KEY (booking_id, room_id))");
      st.execute(
          "CREATE TABLE invoice (invoice_id INT PRIMARY KEY, "
              + "booking_id INT NOT NULL UNIQUE REFERENCES booking(booking_id), "
              + "amount DECIMAL(10,2), issued_at TIMESTAMP WITH TIME ZONE)");
    }
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  private SeedReport seed() {
    final GenerationConfig config =
        GenerationConfig.builder()
            .url(URL)
            .schema("public")
            .outputDir(outDir)
            .rowCountOverrides(COUNTS)
            .build();
    return new SeedPipeline(conn, config, TableAssemblerRegistry.defaults(), Fixtures.CLOCK)
        .run();
  }

  private long scalar(final String sql) throws SQLException {
    try (Statement st = conn.createStatement();
        ResultSet rs = st.executeQuery(sql)) {
      rs.next();
      return rs.getLong(1);
    }
  }

  @Test
  @DisplayName("Every table receives its planned row count")
  void loadsPlannedCounts() throws SQLException {
    final SeedReport report = seed();

    COUNTS.forEach(
        (table, count) -> assertThat(report.loadedFor(table)).as(table).isEqualTo(count));
    assertThat(report.totalRows()).isEqualTo(130);
    assertThat(report.cycles()).isEmpty();
    assertThat(scalar("SELECT COUNT(*) FROM booking_room")).isEqualTo(40);
  }

  @Test
  @DisplayName("Foreign keys, one-to-one children and unique columns hold")
  void keepsConstraints() throws SQLException {
    seed();

    assertThat(scalar("SELECT COUNT(DISTINCT booking_id) FROM invoice")).isEqualTo(25);
    assertThat(scalar("SELECT COUNT(DISTINCT email) FROM customer")).isEqualTo(20);
    assertThat(
            scalar(
                "SELECT COUNT(*) FROM booking b LEFT JOIN customer c "
                    + "ON b.customer_id = c.customer_id WHERE c.customer_id IS NULL"))
        .isZero();
  }

  @Test
  @DisplayName("No booking checks out before it checks in")
  void checkoutFollowsCheckin() throws SQLException {
    seed();

    assertThat(scalar("SELECT COUNT(*) FROM booking WHERE checkout_date < checkin_date"))
        .isZero();
  }

  @Test
  @DisplayName("A CSV file is written per loaded table")
  void writesCsvFiles() {
    seed();

    for (final String table : COUNTS.keySet()) {
      final Path csv = outDir.resolve(table.toUpperCase(Locale.ROOT) + ".csv");
      assertThat(csv).as(table).exists();
    }
  }

  @Test
  @DisplayName("A second run empties the tables first and loads the same counts")
  void rerunTruncates() throws SQLException {
    seed();
    final SeedReport second = seed();

    assertThat(second.loadedFor("booking")).isEqualTo(30);
    assertThat(scalar("SELECT COUNT(*) FROM booking")).isEqualTo(30);
    assertThat(scalar("SELECT COUNT(*) FROM invoice")).isEqualTo(25);
  }
}
