package com.flamingo.ai.contractqa.service.segmentation;

import com.flamingo.ai.contractqa.config.PipelineConfig;
import com.flamingo.ai.contractqa.domain.model.ClauseUnit;
import com.flamingo.ai.contractqa.domain.model.ContractDocument;
import com.flamingo.ai.contractqa.domain.model.SourceSpan;
import com.flamingo.ai.contractqa.exception.EmptyDocumentException;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Splits contract text into clause units along structural boundaries.
 *
 * <p>A new block starts at the first non-blank line after a blank line, at a line that opens a
 * clause (Markdown heading, {@code ARTICLE 3}, {@code 1.}, {@code 1.2}, {@code (a)} and similar)
 * and at an all-caps heading line. A heading-only block is glued to the block that follows it when
 * the result still fits. Blocks whose trimmed text exceeds the maximum unit length are cut at the
 * last sentence break, then at the last whitespace, then hard at the limit.
 *
 * <p>Unit spans tile the input: the first starts at 0, each ends where the next starts and the
 * last ends at the text length. Whitespace between clauses belongs to the preceding unit, except
 * leading whitespace which belongs to the first unit.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClauseSegmenter {

  private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#{1,6}\\s+\\S.*$");

  // digits or an uppercase roman numeral up to CCCXCIX; "Clause civil ..." is body text
  private static final Pattern ARTICLE_HEADING =
      Pattern.compile(
          "^(?i:article|section|clause|schedule|annex|exhibit)\\s+"
              + "(\\d+(\\.\\d+)*"
              + "|(?=[IVXLC])C{0,3}(XC|XL|L?X{0,3})(IX|IV|V?I{0,3})(?![A-Za-z]))\\b.*$");

  private static final Pattern NUMBERED_CLAUSE =
      Pattern.compile(
          "^(\\d+(\\.\\d+)*[.)]\\s+\\S.*"
              + "|\\d+\\.\\d+(\\.\\d+)*\\s+\\S.*"
              + "|\\([a-z]{1,4}\\)\\s+\\S.*"
              + "|[a-z]\\)\\s+\\S.*)$");

  private static final Pattern CAPS_HEADING = Pattern.compile("^[A-Z][A-Z0-9 &,'()/.:-]{2,79}$");

  private static final int MAX_HEADING_LENGTH = 80;

  // "Section 4 Payment Terms" is a title, "Section 4 The Buyer shall pay ..." is a clause
  private static final int MAX_ARTICLE_TITLE = 48;

  private static final String SENTENCE_END = ".!?;:";

  private final PipelineConfig pipelineConfig;

  /**
   * Segments a document into clause units.
   *
   * @param document the document to segment
   * @return units in document order, ordinals starting at 1
   * @throws EmptyDocumentException if the document has no non-whitespace text
   */
  @Timed(value = "segmentation.segment", description = "Time to segment a document")
  public List<ClauseUnit> segment(ContractDocument document) {
    String text = document.text();
    if (text == null || text.isBlank()) {
      throw new EmptyDocumentException(document.id());
    }
    int maxLength = pipelineConfig.getSegmentation().getMaxUnitLength();
    if (maxLength <= 0) {
      throw new IllegalStateException("pipeline.segmentation.max-unit-length must be positive");
    }

    List<int[]> blocks = structuralBlocks(text);
    blocks = absorbLeadingWhitespace(text, blocks);
    blocks = attachHeadings(text, blocks, maxLength);

    List<ClauseUnit> units = new ArrayList<>();
    for (int[] block : blocks) {
      for (int[] piece : splitOversized(text, block[0], block[1], maxLength)) {
        int ordinal = units.size() + 1;
        units.add(
            new ClauseUnit(
                ClauseUnit.idFor(document.id(), ordinal),
                ordinal,
                text.substring(piece[0], piece[1]).strip(),
                new SourceSpan(piece[0], piece[1])));
      }
    }

    log.debug(
        "Segmented document {} ({} chars) into {} units",
        document.id(),
        text.length(),
        units.size());
    return units;
  }

  // ---- structural boundaries ----

  private List<int[]> structuralBlocks(String text) {
    List<Integer> boundaries = new ArrayList<>();
    boundaries.add(0);

    boolean previousBlank = false;
    int lineStart = 0;
    while (lineStart < text.length()) {
      int newline = text.indexOf('\n', lineStart);
      int lineEnd = newline < 0 ? text.length() : newline;
      String line = text.substring(lineStart, lineEnd);
      boolean blank = line.isBlank();

      if (lineStart > 0 && !blank && (previousBlank || opensClause(line.strip()))) {
        boundaries.add(lineStart);
      }

      previousBlank = blank;
      lineStart = newline < 0 ? text.length() : newline + 1;
    }

    List<int[]> blocks = new ArrayList<>();
    for (int i = 0; i < boundaries.size(); i++) {
      int end = i + 1 < boundaries.size() ? boundaries.get(i + 1) : text.length();
      blocks.add(new int[] {boundaries.get(i), end});
    }
    return blocks;
  }

  private boolean opensClause(String line) {
    return MARKDOWN_HEADING.matcher(line).matches()
        || ARTICLE_HEADING.matcher(line).matches()
        || NUMBERED_CLAUSE.matcher(line).matches()
        || isCapsHeading(line);
  }

  private boolean isCapsHeading(String line) {
    if (!CAPS_HEADING.matcher(line).matches()) {
      return false;
    }
    int letters = 0;
    for (int i = 0; i < line.length(); i++) {
      if (Character.isLetter(line.charAt(i))) {
        letters++;
      }
    }
    return letters >= 3;
  }

  private boolean isHeadingOnly(String stripped) {
    if (stripped.indexOf('\n') >= 0 || stripped.length() > MAX_HEADING_LENGTH) {
      return false;
    }
    return MARKDOWN_HEADING.matcher(stripped).matches()
        || ARTICLE_HEADING.matcher(stripped).matches() && stripped.length() <= MAX_ARTICLE_TITLE
        || isCapsHeading(stripped);
  }

  // Only the first block can be whitespace-only: every other block starts on a non-blank line.
  private List<int[]> absorbLeadingWhitespace(String text, List<int[]> blocks) {
    if (blocks.size() > 1 && text.substring(blocks.get(0)[0], blocks.get(0)[1]).isBlank()) {
      List<int[]> merged = new ArrayList<>(blocks.subList(1, blocks.size()));
      merged.set(0, new int[] {0, merged.get(0)[1]});
      return merged;
    }
    return blocks;
  }

  private List<int[]> attachHeadings(String text, List<int[]> blocks, int maxLength) {
    List<int[]> result = new ArrayList<>();
    int pendingStart = -1;
    for (int i = 0; i < blocks.size(); i++) {
      int start = pendingStart >= 0 ? pendingStart : blocks.get(i)[0];
      int end = blocks.get(i)[1];
      pendingStart = -1;

      if (i + 1 < blocks.size()) {
        String own = text.substring(blocks.get(i)[0], end).strip();
        int combined = text.substring(start, blocks.get(i + 1)[1]).strip().length();
        if (isHeadingOnly(own) && combined <= maxLength) {
          pendingStart = start;
          continue;
        }
      }
      result.add(new int[] {start, end});
    }
    return result;
  }

  // ---- length limit ----

  private List<int[]> splitOversized(String text, int start, int end, int maxLength) {
    List<int[]> pieces = new ArrayList<>();
    int pieceStart = start;
    while (strippedLength(text, pieceStart, end) > maxLength) {
      int contentStart = firstNonWhitespace(text, pieceStart, end);
      int cut = findCut(text, contentStart, contentStart + maxLength);
      pieces.add(new int[] {pieceStart, cut});
      pieceStart = cut;
    }
    pieces.add(new int[] {pieceStart, end});
    return pieces;
  }

  /** Finds a cut in (contentStart, limit]; the character at {@code limit} always exists. */
  private int findCut(String text, int contentStart, int limit) {
    for (int p = limit; p > contentStart; p--) {
      if (SENTENCE_END.indexOf(text.charAt(p - 1)) >= 0
          && Character.isWhitespace(text.charAt(p))) {
        return p;
      }
    }
    for (int p = limit; p > contentStart; p--) {
      if (Character.isWhitespace(text.charAt(p))) {
        return p;
      }
    }
    return limit;
  }

  private int strippedLength(String text, int start, int end) {
    int first = firstNonWhitespace(text, start, end);
    if (first == end) {
      return 0;
    }
    int last = end - 1;
    while (Character.isWhitespace(text.charAt(last))) {
      last--;
    }
    return last - first + 1;
  }

  private int firstNonWhitespace(String text, int start, int end) {
    int i = start;
    while (i < end && Character.isWhitespace(text.charAt(i))) {
      i++;
    }
    return i;
  }
}
