package fun.fengwk.bmh.core.service.webcheck;

import fun.fengwk.bmh.core.utils.BalanceNumbers;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the displayed balance in console page HTML.
 *
 * <p>Candidates are tried from the most specific to the most generic: known balance widgets, text next to
 * a balance label, standalone large amounts, leaf nodes of the main containers, then the whole body text.
 *
 * @author fengwk
 */
@Component
public class PageBalanceExtractor {

    private static final List<String> KNOWN_SELECTORS = List.of(
        ".balance-amount",
        "[data-balance]",
        ".amount-display",
        ".wallet-balance",
        ".user-balance",
        ".account-balance",
        ".current-balance",
        "span[class*=balance]",
        "div[class*=balance]"
    );

    private static final List<String> BALANCE_LABELS = List.of("当前余额", "Current Balance", "余额", "Balance");

    private static final List<String> LARGE_TEXT_SELECTORS = List.of(".text-lg", ".text-xl", ".text-2xl", ".text-3xl");

    private static final List<String> CONTAINER_SELECTORS = List.of(
        ".dashboard", ".console", ".account-info", ".user-panel", ".wallet", "main", "#app"
    );

    private static final Pattern DOLLAR_PATTERN = Pattern.compile("\\$([\\d,]+\\.?\\d*)");
    private static final Pattern STANDALONE_AMOUNT_PATTERN = Pattern.compile("^\\$\\s*([\\d,]+\\.?\\d*)$");
    private static final List<Pattern> BODY_PATTERNS = List.of(
        Pattern.compile("当前余额[：:\\s]*\\$([\\d,]+\\.?\\d*)"),
        Pattern.compile("余额[：:\\s]*\\$([\\d,]+\\.?\\d*)"),
        Pattern.compile("Balance[：:\\s]*\\$([\\d,]+\\.?\\d*)", Pattern.CASE_INSENSITIVE)
    );

    /**
     * @return balance text such as {@code $42.5}
     */
    public Optional<String> extract(String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(html);

        for (String selector : KNOWN_SELECTORS) {
            for (Element element : document.select(selector)) {
                Optional<String> found = firstPositiveAmount(element.text(), DOLLAR_PATTERN);
                if (found.isPresent()) {
                    return found;
                }
            }
        }

        for (String label : BALANCE_LABELS) {
            for (Element element : document.select(":containsOwn(" + label + ")")) {
                Element parent = element.parent();
                if (parent == null) {
                    continue;
                }
                for (Element sibling : parent.children()) {
                    Optional<String> found = firstPositiveAmount(sibling.text(), DOLLAR_PATTERN);
                    if (found.isPresent()) {
                        return found;
                    }
                }
                Optional<String> found = firstPositiveAmount(parent.text(), DOLLAR_PATTERN);
                if (found.isPresent()) {
                    return found;
                }
            }
        }

        for (String selector : LARGE_TEXT_SELECTORS) {
            for (Element element : document.select(selector)) {
                Optional<String> found = firstPositiveAmount(element.text().trim(), STANDALONE_AMOUNT_PATTERN);
                if (found.isPresent()) {
                    return found;
                }
            }
        }

        for (String selector : CONTAINER_SELECTORS) {
            Element container = document.selectFirst(selector);
            if (container == null) {
                continue;
            }
            for (Element node : container.select("span, div, p")) {
                if (!node.children().isEmpty()) {
                    continue;
                }
                Optional<String> found = firstPositiveAmount(node.text().trim(), STANDALONE_AMOUNT_PATTERN);
                if (found.isPresent()) {
                    return found;
                }
            }
        }

        String bodyText = document.body() == null ? "" : document.body().text();
        for (Pattern pattern : BODY_PATTERNS) {
            Matcher matcher = pattern.matcher(bodyText);
            if (matcher.find()) {
                Double value = BalanceNumbers.parseFirstNumber(matcher.group(1));
                if (value != null && value >= 0) {
                    return Optional.of(BalanceNumbers.format(value));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> firstPositiveAmount(String text, Pattern pattern) {
        if (text == null || !text.contains("$")) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        Double value = BalanceNumbers.parseFirstNumber(matcher.group(1));
        if (value == null || value <= 0) {
            return Optional.empty();
        }
        return Optional.of(BalanceNumbers.format(value));
    }

}
