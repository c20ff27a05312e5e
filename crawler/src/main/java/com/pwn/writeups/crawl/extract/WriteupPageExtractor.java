package com.pwn.writeups.crawl.extract;

import com.pwn.writeups.config.CrawlerProperties;
import com.pwn.writeups.crawl.model.CatalogRow;
import com.pwn.writeups.crawl.model.DetailLinks;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
public class WriteupPageExtractor {
    private static final int CTF_COLUMN = 0;
    private static final int CHALLENGE_COLUMN = 1;
    private static final int DETAIL_COLUMN = 4;

    private final CrawlerProperties.Selectors selectors;

    public WriteupPageExtractor(CrawlerProperties properties) {
        this.selectors = properties.getSelectors();
    }

    /**
     * Reads the catalogue rows of the index page in document order.
     *
     * @throws PageStructureException if the table is missing or a row lacks one of its anchors
     */
    public List<CatalogRow> extractRows(String html, String baseUri) {
        Document document = Jsoup.parse(html == null ? "" : html, baseUri == null ? "" : baseUri);
        Element table = document.getElementById(selectors.getIndexTableId());
        if (table == null || !"table".equals(table.normalName())) {
            throw new PageStructureException("index table #" + selectors.getIndexTableId() + " not found");
        }

        List<CatalogRow> rows = new ArrayList<>();
        int rowNumber = 0;
        for (Element row : table.select("> tbody > tr")) {
            rowNumber++;
            Elements cells = row.select("> td");
            String ctf = anchorText(cells, CTF_COLUMN, rowNumber, "ctf");
            String challenge = anchorText(cells, CHALLENGE_COLUMN, rowNumber, "challenge");
            String detailPath = anchorHref(cells, DETAIL_COLUMN, rowNumber, "detail link");
            rows.add(new CatalogRow(ctf, challenge, detailPath));
        }
        return rows;
    }

    /**
     * Finds the write-up links of a detail page. Relative hrefs are resolved against {@code pageUrl}.
     */
    public DetailLinks extractLinks(String html, String pageUrl) {
        if (html == null || html.isBlank()) {
            return DetailLinks.none();
        }
        Document document = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);

        Optional<String> inlineLink = Optional.empty();
        Element description = document.getElementById(selectors.getDescriptionId());
        if (description != null) {
            inlineLink = firstHref(description.select("> p > a[href]"));
        }

        String marker = selectors.getFallbackLinkText();
        List<Element> marked = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            if (anchor.ownText().equals(marker)) {
                marked.add(anchor);
            }
        }
        Optional<String> fallbackLink = firstHref(marked);

        return new DetailLinks(inlineLink, fallbackLink);
    }

    private static Optional<String> firstHref(List<Element> anchors) {
        for (Element anchor : anchors) {
            String href = hrefOf(anchor);
            if (href != null) {
                return Optional.of(href);
            }
        }
        return Optional.empty();
    }

    private static String hrefOf(Element anchor) {
        String raw = anchor.attr("href").trim();
        if (raw.isEmpty()) {
            return null;
        }
        String absolute = anchor.absUrl("href");
        return absolute.isEmpty() ? raw : absolute;
    }

    private static Element anchorIn(Elements cells, int column, int rowNumber, String field) {
        if (column >= cells.size()) {
            throw new PageStructureException(
                "index row " + rowNumber + " has " + cells.size() + " cells, missing " + field + " column"
            );
        }
        Element anchor = cells.get(column).selectFirst("a");
        if (anchor == null) {
            throw new PageStructureException("index row " + rowNumber + " has no anchor in " + field + " column");
        }
        return anchor;
    }

    private static String anchorText(Elements cells, int column, int rowNumber, String field) {
        String text = anchorIn(cells, column, rowNumber, field).text().trim();
        if (text.isEmpty()) {
            throw new PageStructureException("index row " + rowNumber + " has an empty " + field + " anchor");
        }
        return text;
    }

    private static String anchorHref(Elements cells, int column, int rowNumber, String field) {
        String href = anchorIn(cells, column, rowNumber, field).attr("href").trim();
        if (href.isEmpty()) {
            throw new PageStructureException("index row " + rowNumber + " has no href in " + field + " column");
        }
        return href;
    }
}
