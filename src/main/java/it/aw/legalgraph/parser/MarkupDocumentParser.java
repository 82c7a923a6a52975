package it.aw.legalgraph.parser;

import it.aw.legalgraph.model.Identifiers;
import it.aw.legalgraph.model.ParsedArticle;
import it.aw.legalgraph.model.ParsedChapter;
import it.aw.legalgraph.model.ParsedDocument;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * XML / HTML via jsoup, in modalità tollerante.
 * <p>
 * Il markup delle fonti è scritto in modo incoerente, quindi un elemento
 * è considerato capo (o articolo) se il nome del tag appartiene al vocabolario
 * OPPURE se l'attributo class contiene la parola chiave, in russo o in inglese,
 * senza distinzione di maiuscole.
 */
public class MarkupDocumentParser implements DocumentFormatParser {

    private static final Logger log = LoggerFactory.getLogger(MarkupDocumentParser.class);

    private static final Set<String> CHAPTER_TAGS = Set.of("chapter", "глава");
    private static final Set<String> ARTICLE_TAGS = Set.of("article", "статья");

    private static final Pattern CHAPTER_CLASS = Pattern.compile("chapter|глава",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern ARTICLE_CLASS = Pattern.compile("article|статья",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    @Override
    public Set<DocumentFormat> formats() {
        return EnumSet.of(DocumentFormat.XML, DocumentFormat.HTML);
    }

    @Override
    public ParsedDocument parse(Path file, DocumentFormat format) throws IOException {
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        ParsedDocument parsed = fromMarkup(Identifiers.fileStem(file), content, format);
        log.debug("Markup {}: {} capi, {} articoli", file.getFileName(),
                parsed.chapters().size(), parsed.articles().size());
        return parsed;
    }

    static ParsedDocument fromMarkup(String fallbackTitle, String content, DocumentFormat format) {
        Document doc = format == DocumentFormat.XML
                ? Jsoup.parse(content, "", Parser.xmlParser())
                : Jsoup.parse(content);

        Element titleElement = doc.selectFirst("title");
        String title = titleElement != null && !titleElement.text().isBlank()
                ? titleElement.text().strip()
                : fallbackTitle;

        List<ParsedChapter> chapters = new ArrayList<>();
        List<ParsedArticle> articles = new ArrayList<>();
        for (Element el : doc.getAllElements()) {
            if (matches(el, CHAPTER_TAGS, CHAPTER_CLASS)) {
                Element heading = el.selectFirst("title, h2, h3");
                chapters.add(new ParsedChapter(
                        numberOf(el, chapters.size() + 1),
                        heading != null ? heading.text() : "",
                        el.text()));
            }
            if (matches(el, ARTICLE_TAGS, ARTICLE_CLASS)) {
                articles.add(new ParsedArticle(numberOf(el, articles.size() + 1), el.text()));
            }
        }
        return new ParsedDocument(title, chapters, articles, doc.text());
    }

    private static boolean matches(Element el, Set<String> tags, Pattern classPattern) {
        if (tags.contains(el.normalName().toLowerCase(Locale.ROOT))) return true;
        String cls = el.className();
        return !cls.isEmpty() && classPattern.matcher(cls).find();
    }

    /** Attributo number, poi id; se entrambi mancano la posizione 1-based nella sorgente. */
    private static String numberOf(Element el, int position) {
        String number = el.attr("number");
        if (number.isBlank()) number = el.attr("id");
        return number.isBlank() ? String.valueOf(position) : number.strip();
    }
}
