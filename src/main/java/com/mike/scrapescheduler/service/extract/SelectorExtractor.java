package com.mike.scrapescheduler.service.extract;

import com.mike.scrapescheduler.dto.ExtractionError;
import com.mike.scrapescheduler.dto.ExtractionResult;
import com.mike.scrapescheduler.entity.FieldValue;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies named CSS selectors to page markup.
 * <ul>
 *     <li>more than one match: list of trimmed texts, in document order</li>
 *     <li>one or no match: the trimmed text (empty when nothing matched)</li>
 *     <li>bad selector: an {@link ExtractionError} for that field, other fields still extracted</li>
 * </ul>
 */
@Component
@Slf4j
public class SelectorExtractor {

    public ExtractionResult extract(String markup, Map<String, String> selectors) {
        if (selectors == null || selectors.isEmpty()) {
            return ExtractionResult.empty();
        }

        Document doc = Jsoup.parse(markup == null ? "" : markup);

        Map<String, FieldValue> fields = new LinkedHashMap<>();
        List<ExtractionError> errors = new ArrayList<>();

        for (Map.Entry<String, String> entry : selectors.entrySet()) {
            String field = entry.getKey();
            String selector = entry.getValue();

            if (selector == null || selector.isBlank()) {
                errors.add(new ExtractionError(field, selector, "Selector is blank"));
                continue;
            }

            Elements matches;
            try {
                matches = doc.select(selector);
            } catch (Selector.SelectorParseException | IllegalArgumentException e) {
                log.warn("SelectorExtractor: field '{}' has invalid selector '{}': {}", field, selector, e.getMessage());
                errors.add(new ExtractionError(field, selector, e.getMessage()));
                continue;
            }

            fields.put(field, toValue(matches));
        }

        return new ExtractionResult(fields, errors);
    }

    private FieldValue toValue(Elements matches) {
        if (matches.size() > 1) {
            List<String> texts = new ArrayList<>(matches.size());
            for (Element el : matches) {
                texts.add(el.text().trim());
            }
            return FieldValue.items(texts);
        }
        return FieldValue.text(matches.text().trim());
    }
}
