package io.healthexporter.api.handlers;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

/**
 * Landing page pointing operators at the scrape endpoint.
 */
@RestController
public class LandingHandler {

    private final String telemetryPath;

    public LandingHandler(@Value("${web.telemetryPath:/metrics}") String telemetryPath) {
        this.telemetryPath = telemetryPath;
    }

    @GetMapping("/")
    public ResponseEntity<String> index() {
        String path = HtmlUtils.htmlEscape(telemetryPath);
        String page = "<html>"
            + "<head><title>Cluster Health Exporter</title></head>"
            + "<body>"
            + "<h1>Cluster Health Exporter</h1>"
            + "<p><a href=\"" + path + "\">Metrics</a></p>"
            + "</body>"
            + "</html>";
        return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(page);
    }
}
