package io.jobrelay.supervisor;

import io.jobrelay.model.MetaKeys;
import io.jobrelay.progress.ProgressReconciler;
import io.jobrelay.progress.ToolProgress;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans stdout lines for the markers a pipeline prints and records them in job meta.
 */
public final class OutputSignals {
    private static final Logger LOG = LogManager.getLogger(OutputSignals.class);
    static final String STATUS_PREFIX = "status::";
    static final String PROGRESS_PREFIX = "progress::";
    static final String RESULTS_PREFIX = "Results directory:";
    static final String SUCCESS = "success";
    private static final Pattern SUBPROCESS = Pattern.compile("(?:Submitted|Starting) process > (.+)$");

    private final MetaBuffer meta;
    private boolean successMarker;
    private String resultsPath;
    private ToolProgress lastTool;

    public OutputSignals(MetaBuffer meta) {
        this.meta = meta;
    }

    /**
     * @return true when the line carried tool progress counts
     */
    public boolean scan(String line) {
        if (line == null) {
            return false;
        }
        String trimmed = line.trim();
        if (trimmed.startsWith(STATUS_PREFIX)) {
            String value = trimmed.substring(STATUS_PREFIX.length()).trim();
            meta.put(MetaKeys.PIPELINE_STATUS, value);
            successMarker = SUCCESS.equals(value.toLowerCase(Locale.ROOT));
            return false;
        }
        if (trimmed.startsWith(PROGRESS_PREFIX)) {
            String value = trimmed.substring(PROGRESS_PREFIX.length()).trim();
            try {
                meta.put(MetaKeys.OVERALL_PROGRESS, ProgressReconciler.clamp(Integer.parseInt(value)));
            } catch (NumberFormatException e) {
                LOG.debug("Ignoring non-numeric progress marker: {}", value);
            }
            return false;
        }
        int results = trimmed.indexOf(RESULTS_PREFIX);
        if (results >= 0) {
            String path = trimmed.substring(results + RESULTS_PREFIX.length()).trim();
            if (!path.isEmpty()) {
                resultsPath = path;
                meta.put(MetaKeys.RESULTS_PATH, path);
            }
            return false;
        }
        Matcher m = SUBPROCESS.matcher(trimmed);
        if (m.find()) {
            String label = simplifiedLabel(m.group(1));
            meta.put(MetaKeys.CURRENT_PROCESS, label);
            meta.put(MetaKeys.CURRENT_TASK, label);
        }
        Optional<ToolProgress> tool = ToolProgress.parse(trimmed);
        if (tool.isPresent()) {
            lastTool = tool.get();
            meta.put(MetaKeys.TOOL_PERCENT, ProgressReconciler.clamp(lastTool.percent()));
            meta.put(MetaKeys.TOOL_COMPLETED, lastTool.completed());
            meta.put(MetaKeys.TOOL_SUBMITTED, lastTool.submitted());
            return true;
        }
        return false;
    }

    static String simplifiedLabel(String raw) {
        String name = raw.trim();
        int paren = name.indexOf(" (");
        if (paren > 0) {
            name = name.substring(0, paren);
        }
        int colon = name.lastIndexOf(':');
        return colon >= 0 ? name.substring(colon + 1).trim() : name;
    }

    public boolean successMarker() {
        return successMarker;
    }

    public String resultsPath() {
        return resultsPath;
    }

    public ToolProgress lastTool() {
        return lastTool;
    }
}
