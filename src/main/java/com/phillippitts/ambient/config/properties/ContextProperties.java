package com.phillippitts.ambient.config.properties;

import com.phillippitts.ambient.domain.ContextPattern;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Context engine configuration: the quiet window and patterns seeded at startup.
 *
 * <p>Quiet hours are local clock hours. {@code start == end} disables the window;
 * {@code start > end} wraps past midnight.
 */
@Validated
@ConfigurationProperties(prefix = "ambient.context")
public class ContextProperties {

    @Min(0)
    @Max(23)
    private int quietHoursStart = 0;

    @Min(0)
    @Max(23)
    private int quietHoursEnd = 0;

    private List<ContextPattern> patterns = new ArrayList<>();

    public int getQuietHoursStart() {
        return quietHoursStart;
    }

    public void setQuietHoursStart(int quietHoursStart) {
        this.quietHoursStart = quietHoursStart;
    }

    public int getQuietHoursEnd() {
        return quietHoursEnd;
    }

    public void setQuietHoursEnd(int quietHoursEnd) {
        this.quietHoursEnd = quietHoursEnd;
    }

    public List<ContextPattern> getPatterns() {
        return patterns;
    }

    public void setPatterns(List<ContextPattern> patterns) {
        this.patterns = patterns == null ? new ArrayList<>() : patterns;
    }
}
