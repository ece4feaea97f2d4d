package com.appmonitor.collector.output;

import com.appmonitor.collector.model.AlertRule;
import com.appmonitor.collector.model.ComparisonMode;
import com.appmonitor.collector.model.Metric;
import com.appmonitor.collector.model.MonitoredApp;
import com.appmonitor.collector.model.Platform;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAppCatalogTest {

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private JdbcAppCatalog catalog;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("schema.sql")
                .build();
        jdbcTemplate = new JdbcTemplate(database);
        catalog = new JdbcAppCatalog(jdbcTemplate);
        jdbcTemplate.update("INSERT INTO apps (id, name, platform, external_id, report_target) "
                + "VALUES (1, 'Demo iOS', 'ios', '123456', 'https://hooks.test/reports')");
        jdbcTemplate.update("INSERT INTO apps (id, name, platform, external_id, active) "
                + "VALUES (2, 'Old Android', 'android', 'com.example.old', FALSE)");
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void testFindActiveApps() {
        // When
        List<MonitoredApp> apps = catalog.findActiveApps();

        // Then
        assertEquals(1, apps.size());
        assertEquals(Platform.IOS, apps.get(0).getPlatform());
        assertEquals("https://hooks.test/reports", apps.get(0).getReportTarget());
        assertEquals(Platform.ANDROID, catalog.findApp(2L).orElseThrow().getPlatform());
        assertTrue(catalog.findApp(3L).isEmpty());
    }

    @Test
    void testFindActiveRules_SkipsUnknownMetric() {
        // Given
        jdbcTemplate.update("INSERT INTO alert_rules (app_id, metric, comparison_mode, threshold_min, threshold_max) "
                + "VALUES (1, 'downloads', 'dod', -20, 50)");
        jdbcTemplate.update("INSERT INTO alert_rules (app_id, metric, comparison_mode, threshold_min) "
                + "VALUES (1, 'crashes', 'dod', -20)");
        jdbcTemplate.update("INSERT INTO alert_rules (app_id, metric, comparison_mode, threshold_max, active) "
                + "VALUES (1, 'sessions', 'absolute', 1000, FALSE)");

        // When
        List<AlertRule> rules = catalog.findActiveRules(1L);

        // Then
        assertEquals(1, rules.size());
        AlertRule rule = rules.get(0);
        assertEquals("Demo iOS", rule.getAppName());
        assertEquals(Metric.DOWNLOADS, rule.getMetric());
        assertEquals(ComparisonMode.DOD, rule.getComparisonMode());
        assertEquals(-20.0, rule.getThresholdMin());
        assertEquals(50.0, rule.getThresholdMax());
    }
}
