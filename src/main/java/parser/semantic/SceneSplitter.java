package parser.semantic;

import model.DeviceType;
import model.Scene;
import parser.interaction.InteractionSyntax;
import parser.interaction.SourceLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts a document into scene blocks at {@code ---} lines and at every
 * {@code @scene:} after the first one of a block, and reads the
 * {@code @scene / @title / @transition / @device} directives.
 */
public final class SceneSplitter {

    private static final Pattern SEPARATOR = Pattern.compile("^-{3,}$");
    private static final Pattern DIRECTIVE = Pattern.compile("^@(scene|title|transition|device)\\s*:\\s*(.*)$");

    private final boolean extractInteractions;

    public SceneSplitter(boolean extractInteractions) {
        this.extractInteractions = extractInteractions;
    }

    public List<SceneBlock> split(List<String> lines) {
        List<SceneBlock> blocks = new ArrayList<>();
        Builder current = new Builder(0);

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String t = line.strip();

            if (SEPARATOR.matcher(t).matches()) {
                current.finishInto(blocks);
                current = new Builder(i + 1);
                continue;
            }

            Matcher d = DIRECTIVE.matcher(t);
            if (d.matches()) {
                String key = d.group(1);
                if ("scene".equals(key) && current.id != null) {
                    current.finishInto(blocks);
                    current = new Builder(i);
                }
                current.directive(key, d.group(2).strip(), i);
                current.add("");
                continue;
            }

            if (extractInteractions && InteractionSyntax.isSelector(line)) {
                current.interactions.add(new SourceLine(i, line));
                current.add("");
                int j = i + 1;
                while (j < lines.size() && InteractionSyntax.isBodyLine(lines.get(j))) {
                    current.interactions.add(new SourceLine(j, lines.get(j)));
                    current.add("");
                    j++;
                }
                i = j - 1;
                continue;
            }
            current.add(line);
        }
        current.finishInto(blocks);
        return blocks;
    }

    static String capitalize(String id) {
        if (id == null || id.isEmpty()) return id;
        return id.substring(0, 1).toUpperCase(Locale.ROOT) + id.substring(1);
    }

    private static final class Builder {
        private final int offset;
        private final List<String> lines = new ArrayList<>();
        private final List<SourceLine> interactions = new ArrayList<>();
        private String id;
        private int declaredAt = -1;
        private String title;
        private String transition;
        private DeviceType device;
        private boolean hasDirective;

        Builder(int offset) {
            this.offset = offset;
        }

        void add(String line) {
            lines.add(line);
        }

        void directive(String key, String value, int row) {
            hasDirective = true;
            switch (key) {
                case "scene" -> { id = value; declaredAt = row; }
                case "title" -> title = value;
                case "transition" -> transition = value;
                case "device" -> device = DeviceType.fromLabel(value);
                default -> { }
            }
        }

        void finishInto(List<SceneBlock> out) {
            boolean blank = lines.stream().allMatch(String::isBlank) && interactions.isEmpty();
            if (blank && !hasDirective) return;

            String sceneId = (id == null || id.isEmpty()) ? Scene.DEFAULT_ID : id;
            String sceneTitle = (title == null || title.isEmpty()) ? capitalize(sceneId) : title;
            String sceneTransition = (transition == null || transition.isEmpty()) ? Scene.DEFAULT_TRANSITION : transition;
            DeviceType sceneDevice = device == null ? DeviceType.DESKTOP : device;
            int declared = declaredAt >= 0 ? declaredAt : offset;
            out.add(new SceneBlock(sceneId, sceneTitle, sceneTransition, sceneDevice,
                    id != null && !id.isEmpty(), declared, offset, lines, interactions));
        }
    }
}
