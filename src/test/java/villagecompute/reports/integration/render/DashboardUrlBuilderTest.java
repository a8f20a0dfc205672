package villagecompute.reports.integration.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.reports.api.types.DashboardVariableType;
import villagecompute.reports.data.models.ReportSchedule;

/**
 * Unit tests for {@link DashboardUrlBuilder}.
 */
class DashboardUrlBuilderTest {

    private ReportSchedule schedule;

    @BeforeEach
    void setUp() {
        schedule = new ReportSchedule();
        schedule.dashboardUid = "abc123";
        schedule.rangeFrom = "now-7d";
        schedule.rangeTo = "now";
        schedule.timezone = "America/New_York";
    }

    @Test
    void testQueryKeysAreSorted() {
        assertEquals("http://grafana:3000/d/abc123?from=now-7d&kiosk=1&theme=light&to=now&tz=America%2FNew_York",
                DashboardUrlBuilder.build("http://grafana:3000", schedule));
    }

    @Test
    void testSubPathIsPreserved() {
        String url = DashboardUrlBuilder.build("https://example.com/grafana/", schedule);

        assertEquals("https://example.com/grafana/d/abc123?from=now-7d&kiosk=1&theme=light&to=now&tz=America%2FNew_York",
                url);
    }

    @Test
    void testRepeatedVariablesKeepEveryValueInOrder() {
        schedule.timezone = "";
        schedule.variables = List.of(new DashboardVariableType("host", "web-2"), new DashboardVariableType("env", "prod"),
                new DashboardVariableType("host", "web 1"));

        String url = DashboardUrlBuilder.build("http://grafana:3000", schedule);

        assertEquals("http://grafana:3000/d/abc123?from=now-7d&kiosk=1&theme=light&to=now"
                + "&var-env=prod&var-host=web-2&var-host=web+1", url);
    }

    @Test
    void testRelativeBaseUrlRejected() {
        assertThrows(IllegalArgumentException.class, () -> DashboardUrlBuilder.validateBaseUrl("grafana/dash"));
        assertThrows(IllegalArgumentException.class, () -> DashboardUrlBuilder.validateBaseUrl(" "));
        assertThrows(IllegalArgumentException.class, () -> DashboardUrlBuilder.validateBaseUrl("http://bad host"));
    }
}
