package com.flamingo.ai.literatureingest.pubmed;

import com.flamingo.ai.literatureingest.domain.model.RecordMetadata;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Streams a PubmedArticleSet document and extracts {@link RecordMetadata} per article.
 *
 * <p>Articles are read one at a time, so a malformed article only affects itself. If the document
 * breaks off, the articles read so far are kept and the result is flagged incomplete. DTDs and
 * external entities are never loaded.
 */
@Component
@Slf4j
public class PubMedXmlParser {

  private static final Map<String, String> MONTHS =
      Map.ofEntries(
          Map.entry("jan", "01"),
          Map.entry("feb", "02"),
          Map.entry("mar", "03"),
          Map.entry("apr", "04"),
          Map.entry("may", "05"),
          Map.entry("jun", "06"),
          Map.entry("jul", "07"),
          Map.entry("aug", "08"),
          Map.entry("sep", "09"),
          Map.entry("oct", "10"),
          Map.entry("nov", "11"),
          Map.entry("dec", "12"));

  private final XMLInputFactory xmlInputFactory;

  public PubMedXmlParser() {
    xmlInputFactory = XMLInputFactory.newFactory();
    xmlInputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    xmlInputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    xmlInputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
  }

  public ParsedArticles parse(String xml) {
    List<RecordMetadata> records = new ArrayList<>();
    Map<String, String> failures = new LinkedHashMap<>();
    boolean complete = true;

    XMLStreamReader reader = null;
    try {
      reader = xmlInputFactory.createXMLStreamReader(new StringReader(xml));
      while (reader.hasNext()) {
        if (reader.next() == XMLStreamConstants.START_ELEMENT
            && "PubmedArticle".equals(reader.getLocalName())) {
          accept(readArticle(reader), records, failures);
        }
      }
    } catch (XMLStreamException e) {
      complete = false;
      log.warn(
          "efetch response unparseable after {} articles: {}", records.size(), e.getMessage());
    } finally {
      close(reader);
    }
    return new ParsedArticles(records, failures, complete);
  }

  private void accept(
      ArticleFields article, List<RecordMetadata> records, Map<String, String> failures) {
    if (article.pmid == null || article.pmid.isBlank()) {
      log.warn("Skipping PubmedArticle without a PMID");
      return;
    }
    String abstractText = String.join("\n", article.abstractSections);
    if (isBlank(article.title) && abstractText.isBlank()) {
      failures.put(article.pmid, "article has neither title nor abstract");
      return;
    }
    records.add(
        RecordMetadata.builder()
            .recordId(article.pmid)
            .title(article.title)
            .authors(article.authors)
            .journal(article.journal)
            .publicationDate(article.publicationDate())
            .doi(article.elocationDoi != null ? article.elocationDoi : article.articleIdDoi)
            .fullTextId(article.pmcId)
            .abstractText(abstractText)
            .build());
  }

  private ArticleFields readArticle(XMLStreamReader reader) throws XMLStreamException {
    ArticleFields article = new ArticleFields();
    Deque<String> path = new ArrayDeque<>();
    path.push("PubmedArticle");
    AuthorName author = null;

    while (reader.hasNext()) {
      int event = reader.next();
      if (event == XMLStreamConstants.END_ELEMENT) {
        String closed = path.pop();
        if ("Author".equals(closed) && author != null) {
          String name = author.displayName();
          if (!name.isEmpty()) {
            article.authors.add(name);
          }
          author = null;
        }
        if (path.isEmpty()) {
          return article;
        }
        continue;
      }
      if (event != XMLStreamConstants.START_ELEMENT) {
        continue;
      }

      String name = reader.getLocalName();
      String parent = path.peek();
      if (readLeaf(reader, name, parent, ancestor(path, 1), article, author)) {
        continue;
      }
      path.push(name);
      if ("Author".equals(name) && "AuthorList".equals(parent)) {
        author = new AuthorName();
      }
    }
    throw new XMLStreamException("Document ended inside PubmedArticle");
  }

  /**
   * Reads a known leaf element through its end tag.
   *
   * @return true if the element was consumed
   */
  private boolean readLeaf(
      XMLStreamReader reader,
      String name,
      String parent,
      String grandparent,
      ArticleFields article,
      AuthorName author)
      throws XMLStreamException {
    switch (name) {
      case "PMID":
        if ("MedlineCitation".equals(parent)) {
          article.pmid = readText(reader);
          return true;
        }
        return false;
      case "ArticleTitle":
        if ("Article".equals(parent)) {
          article.title = readText(reader);
          return true;
        }
        return false;
      case "AbstractText":
        if ("Abstract".equals(parent)) {
          String label = reader.getAttributeValue(null, "Label");
          String text = readText(reader);
          if (!text.isEmpty()) {
            article.abstractSections.add(isBlank(label) ? text : label + ": " + text);
          }
          return true;
        }
        return false;
      case "LastName", "ForeName", "CollectiveName":
        if ("Author".equals(parent) && author != null) {
          String text = readText(reader);
          if ("LastName".equals(name)) {
            author.lastName = text;
          } else if ("ForeName".equals(name)) {
            author.foreName = text;
          } else {
            author.collectiveName = text;
          }
          return true;
        }
        return false;
      case "Title":
        if ("Journal".equals(parent)) {
          article.journal = readText(reader);
          return true;
        }
        return false;
      case "Year", "Month", "Day", "MedlineDate":
        if ("PubDate".equals(parent)) {
          String text = readText(reader);
          switch (name) {
            case "Year" -> article.year = text;
            case "Month" -> article.month = text;
            case "Day" -> article.day = text;
            default -> article.medlineDate = text;
          }
          return true;
        }
        return false;
      case "ELocationID":
        if ("Article".equals(parent)) {
          String type = reader.getAttributeValue(null, "EIdType");
          String valid = reader.getAttributeValue(null, "ValidYN");
          String text = readText(reader);
          if ("doi".equalsIgnoreCase(type) && !"N".equals(valid) && article.elocationDoi == null) {
            article.elocationDoi = emptyToNull(text);
          }
          return true;
        }
        return false;
      case "ArticleId":
        if ("ArticleIdList".equals(parent) && "PubmedData".equals(grandparent)) {
          String type = reader.getAttributeValue(null, "IdType");
          String text = readText(reader);
          if ("pmc".equalsIgnoreCase(type)) {
            article.pmcId = emptyToNull(stripPmcPrefix(text));
          } else if ("doi".equalsIgnoreCase(type)) {
            article.articleIdDoi = emptyToNull(text);
          }
          return true;
        }
        return false;
      default:
        return false;
    }
  }

  /** Concatenates all text inside the current element, flattening inline markup. */
  private static String readText(XMLStreamReader reader) throws XMLStreamException {
    StringBuilder text = new StringBuilder();
    int depth = 1;
    while (depth > 0) {
      switch (reader.next()) {
        case XMLStreamConstants.CHARACTERS,
            XMLStreamConstants.CDATA,
            XMLStreamConstants.SPACE -> text.append(reader.getText());
        case XMLStreamConstants.START_ELEMENT -> depth++;
        case XMLStreamConstants.END_ELEMENT -> depth--;
        default -> {}
      }
    }
    return text.toString().replaceAll("\\s+", " ").trim();
  }

  private static String ancestor(Deque<String> path, int level) {
    Iterator<String> iterator = path.iterator();
    String current = null;
    for (int i = 0; i <= level && iterator.hasNext(); i++) {
      current = iterator.next();
    }
    return current;
  }

  private static String stripPmcPrefix(String value) {
    String trimmed = value.trim();
    return trimmed.toUpperCase(Locale.ROOT).startsWith("PMC") ? trimmed.substring(3) : trimmed;
  }

  private static String emptyToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static void close(XMLStreamReader reader) {
    if (reader == null) {
      return;
    }
    try {
      reader.close();
    } catch (XMLStreamException e) {
      log.debug("Failed to close XML reader: {}", e.getMessage());
    }
  }

  private static final class ArticleFields {
    private String pmid;
    private String title;
    private final List<String> abstractSections = new ArrayList<>();
    private final List<String> authors = new ArrayList<>();
    private String journal;
    private String year;
    private String month;
    private String day;
    private String medlineDate;
    private String elocationDoi;
    private String articleIdDoi;
    private String pmcId;

    private String publicationDate() {
      if (isBlank(year)) {
        return isBlank(medlineDate) ? null : medlineDate;
      }
      String monthNumber = monthNumber(month);
      if (monthNumber == null) {
        return year;
      }
      if (isBlank(day) || !day.chars().allMatch(Character::isDigit)) {
        return year + "-" + monthNumber;
      }
      return year + "-" + monthNumber + "-" + (day.length() == 1 ? "0" + day : day);
    }

    private static String monthNumber(String month) {
      if (isBlank(month)) {
        return null;
      }
      if (month.length() <= 2 && month.chars().allMatch(Character::isDigit)) {
        int value = Integer.parseInt(month);
        return value >= 1 && value <= 12 ? String.format(Locale.ROOT, "%02d", value) : null;
      }
      String key = month.length() >= 3 ? month.substring(0, 3).toLowerCase(Locale.ROOT) : "";
      return MONTHS.get(key);
    }
  }

  private static final class AuthorName {
    private String lastName;
    private String foreName;
    private String collectiveName;

    private String displayName() {
      if (!isBlank(lastName)) {
        return isBlank(foreName) ? lastName : foreName + " " + lastName;
      }
      return isBlank(collectiveName) ? "" : collectiveName;
    }
  }
}
