package it.aw.legalgraph.parser;

import it.aw.legalgraph.model.ParsedArticle;
import it.aw.legalgraph.model.ParsedChapter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recupera capi e articoli dal testo piano usando solo pattern espliciti
 * (keyword + numero), in russo e in inglese.
 * <p>
 * Due famiglie di pattern:
 * <ul>
 *   <li>intestazione + corpo: "Статья N" seguita dal testo fino alla prossima
 *       intestazione dello stesso tipo o alla fine del testo (match greedy,
 *       non sovrapposti, case-insensitive, su tutto il testo)</li>
 *   <li>intestazione a inizio riga: usata per l'indice pagina → articolo dei PDF,
 *       per non confondere un'intestazione con un rinvio nel corpo ("по ст. 55",
 *       "согласно статье 55")</li>
 * </ul>
 */
public final class StructureDetector {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final String ARTICLE_KEYWORD = "(?:Статья|Article)";
    private static final String CHAPTER_KEYWORD = "(?:Глава|Chapter)";

    private static final int CHAPTER_TITLE_MAX = 100;

    /** "Статья 12.1. Testo..." fino alla prossima "Статья N" o alla fine. */
    private static final Pattern ARTICLE_BLOCK = Pattern.compile(
            ARTICLE_KEYWORD + "\\s+(\\d+(?:\\.\\d+)?)\\.?\\s*(.*?)(?=" + ARTICLE_KEYWORD + "\\s+\\d+|\\z)",
            FLAGS | Pattern.DOTALL);

    /**
     * "Глава 3. Titolo..." fino alla prossima "Глава N" o alla fine.
     * Non si ferma sulle intestazioni di articolo: il titolo catturato è troncato.
     */
    private static final Pattern CHAPTER_BLOCK = Pattern.compile(
            CHAPTER_KEYWORD + "\\s+(\\d+)\\s*[.\\-]?\\s*(.*?)(?=" + CHAPTER_KEYWORD + "\\s+\\d+|\\z)",
            FLAGS | Pattern.DOTALL);

    /** Intestazione di articolo ancorata a inizio riga. */
    public static final Pattern ARTICLE_LINE_HEADER = Pattern.compile(
            "^\\s*" + ARTICLE_KEYWORD + "\\s+(\\d+(?:\\.\\d+)?)\\b",
            FLAGS | Pattern.MULTILINE);

    private StructureDetector() {}

    /**
     * Articoli nell'ordine del testo. Nessuna intestazione → lista vuota.
     */
    public static List<ParsedArticle> articles(String text) {
        List<ParsedArticle> articles = new ArrayList<>();
        if (text == null || text.isEmpty()) return articles;
        Matcher m = ARTICLE_BLOCK.matcher(text);
        while (m.find()) {
            articles.add(new ParsedArticle(m.group(1), m.group(2).strip()));
        }
        return articles;
    }

    public static List<ParsedChapter> chapters(String text) {
        List<ParsedChapter> chapters = new ArrayList<>();
        if (text == null || text.isEmpty()) return chapters;
        Matcher m = CHAPTER_BLOCK.matcher(text);
        while (m.find()) {
            String body = m.group(2).strip();
            String title = body.length() > CHAPTER_TITLE_MAX ? body.substring(0, CHAPTER_TITLE_MAX) : body;
            chapters.add(new ParsedChapter(m.group(1), title, body));
        }
        return chapters;
    }

    /**
     * Scansiona il testo di una pagina e registra in pageMap la pagina dei
     * numeri di articolo visti per la prima volta (la prima occorrenza vince).
     *
     * @param pageText   testo estratto della pagina (può essere vuoto)
     * @param pageNumber numero di pagina 1-based
     * @param pageMap    mappa numero articolo → pagina, aggiornata in place
     * @return numeri aggiunti alla mappa da questa pagina
     */
    public static List<String> recordArticleHeaders(String pageText, int pageNumber, Map<String, Integer> pageMap) {
        List<String> added = new ArrayList<>();
        if (pageText == null || pageText.isEmpty()) return added;
        Matcher m = ARTICLE_LINE_HEADER.matcher(pageText);
        while (m.find()) {
            String number = m.group(1);
            if (!pageMap.containsKey(number)) {
                pageMap.put(number, pageNumber);
                added.add(number);
            }
        }
        return added;
    }

    /**
     * Mappa completa numero articolo → pagina di inizio, dati i testi delle pagine
     * (indice 0 = pagina 1).
     */
    public static Map<String, Integer> articlePageMap(List<String> pageTexts) {
        Map<String, Integer> pageMap = new LinkedHashMap<>();
        for (int i = 0; i < pageTexts.size(); i++) {
            recordArticleHeaders(pageTexts.get(i), i + 1, pageMap);
        }
        return pageMap;
    }
}
