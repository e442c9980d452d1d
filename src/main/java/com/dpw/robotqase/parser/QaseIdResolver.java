package com.dpw.robotqase.parser;

import com.dpw.robotqase.exception.ReportParseException;
import com.dpw.robotqase.exception.ReportParseException.Reason;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds the Qase case id of a test record in its {@code <tag>} children, e.g. {@code <tag>Q-1234</tag>}.
 * Tags are checked in document order and the first one containing the pattern wins.
 */
@Component
public class QaseIdResolver {

    static final String TAG_ELEMENT = "tag";
    private static final Pattern QASE_ID_PATTERN = Pattern.compile("Q-(\\d+)");

    public long resolve(Element test) {
        List<Element> tags = directChildren(test, TAG_ELEMENT);
        if (tags.isEmpty()) {
            throw new ReportParseException(Reason.NO_TAGS_FOUND, "Cannot find tag element");
        }

        for (Element tag : tags) {
            String text = tag.text();
            Matcher matcher = QASE_ID_PATTERN.matcher(text);
            if (matcher.find()) {
                long qaseId;
                try {
                    qaseId = Long.parseLong(matcher.group(1));
                } catch (NumberFormatException e) {
                    throw new ReportParseException(Reason.IDENTIFIER_NOT_FOUND,
                            "Qase ID out of range in tag '" + text + "'", text, e);
                }
                if (qaseId <= 0) {
                    throw new ReportParseException(Reason.IDENTIFIER_NOT_FOUND,
                            "Qase ID must be positive in tag '" + text + "'", text, null);
                }
                return qaseId;
            }
        }

        throw new ReportParseException(Reason.IDENTIFIER_NOT_FOUND, "Cannot find Qase ID in tags "
                + tags.stream().map(Element::text).collect(Collectors.joining(", ", "[", "]")));
    }

    static List<Element> directChildren(Element parent, String tagName) {
        return parent.children().stream()
                .filter(child -> tagName.equals(child.tagName()))
                .toList();
    }
}
