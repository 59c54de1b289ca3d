package com.flamingo.ai.contractqa.service.render;

import com.flamingo.ai.contractqa.domain.model.ClauseReference;
import com.flamingo.ai.contractqa.domain.model.ContractAnswer;
import java.util.List;
import org.springframework.stereotype.Component;

/** Renders a validated answer as a Markdown report. */
@Component
public class AnswerMarkdownRenderer {

  public String render(ContractAnswer answer) {
    StringBuilder sb = new StringBuilder();
    sb.append("## Summary\n\n").append(answer.summary().strip()).append("\n\n");
    appendList(sb, "Obligations", answer.obligations());
    appendList(sb, "Penalties", answer.penalties());
    appendList(sb, "Risks", answer.risks());

    sb.append("## Supporting Clauses\n\n");
    if (answer.supportingClauses().isEmpty()) {
      sb.append("_None_\n");
    }
    for (ClauseReference clause : answer.supportingClauses()) {
      sb.append("- **").append(clause.id()).append("**: ");
      sb.append(clause.text().strip().replaceAll("\\s*\\n\\s*", " ")).append('\n');
    }
    return sb.toString();
  }

  private void appendList(StringBuilder sb, String title, List<String> items) {
    sb.append("## ").append(title).append("\n\n");
    if (items.isEmpty()) {
      sb.append("_None_\n\n");
      return;
    }
    for (String item : items) {
      sb.append("- ").append(item.strip()).append('\n');
    }
    sb.append('\n');
  }
}
