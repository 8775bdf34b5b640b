package io.scrapehive.supervisor.spring;

import io.scrapehive.supervisor.runtime.SupervisorLifecycle;
import io.scrapehive.supervisor.status.ScrapeStatusJson;
import java.util.Objects;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the supervisor. Target status is rendered with
 * {@link ScrapeStatusJson} so the payload does not depend on the host's ObjectMapper.
 */
@RestController
@RequestMapping("/api/scrape")
public class ScrapeStatusController {
    private final SupervisorLifecycle supervisor;

    public ScrapeStatusController(SupervisorLifecycle supervisor) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    }

    @GetMapping(value = "/targets", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> targets() {
        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .body(ScrapeStatusJson.write(supervisor.status()));
    }

    @GetMapping("/supervisor")
    public ResponseEntity<SupervisorView> supervisor() {
        return ResponseEntity.ok(new SupervisorView(
            supervisor.getState().name(),
            supervisor.isScraping(),
            supervisor.currentArguments().targets().size()));
    }

    public record SupervisorView(String state, boolean scraping, int targets) {}
}
