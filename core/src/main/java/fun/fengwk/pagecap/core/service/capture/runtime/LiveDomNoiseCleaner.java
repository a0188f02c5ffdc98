package fun.fengwk.pagecap.core.service.capture.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.pagecap.core.service.browser.RenderedPageHandle;
import fun.fengwk.pagecap.core.service.capture.parser.NoiseFilter;
import fun.fengwk.pagecap.core.service.capture.parser.NoiseRule;
import fun.fengwk.pagecap.core.service.capture.parser.NoiseRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies the noise rules to the live page after its source has been read, so the body text and the
 * screenshot show the page without boilerplate.
 *
 * <p>Each rule runs as its own script, a failing rule is skipped. Elements wrapping a content landmark are kept.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiveDomNoiseCleaner {

    private static final String RULE_SCRIPT_TEMPLATE = """
        (() => {
          const rule = %s;
          const landmarks = %s;
          const separator = /[\\s_-]+/;
          const matches = (el) => {
            if (rule.tagNames.includes(el.tagName.toLowerCase())) {
              return true;
            }
            for (const name of rule.attributeNames) {
              const value = (el.getAttribute(name) || '').toLowerCase();
              if (!value) {
                continue;
              }
              if (value.split(separator).some((token) => rule.tokens.includes(token))) {
                return true;
              }
              if (rule.substrings.some((substring) => value.includes(substring))) {
                return true;
              }
            }
            return false;
          };
          if (!document.body) {
            return 0;
          }
          let removed = 0;
          for (const el of Array.from(document.body.querySelectorAll('*'))) {
            if (el.isConnected && matches(el) && !el.querySelector(landmarks)) {
              el.remove();
              removed++;
            }
          }
          return removed;
        })()
        """;

    private final NoiseFilter noiseFilter;
    private final ObjectMapper objectMapper;

    /**
     * @return number of elements removed from the page
     */
    public int clean(RenderedPageHandle handle) {
        int removed = 0;
        for (NoiseRule rule : noiseFilter.getRules()) {
            try {
                Object result = handle.executeScript(buildScript(rule));
                if (result instanceof Number number) {
                    removed += number.intValue();
                }
            } catch (RuntimeException | JsonProcessingException ex) {
                log.debug("live noise rule skipped, rule={}, error={}", rule.name(), ex.getMessage());
            }
        }
        log.debug("live noise cleanup finished, removed={}", removed);
        return removed;
    }

    String buildScript(NoiseRule rule) throws JsonProcessingException {
        return RULE_SCRIPT_TEMPLATE.formatted(
            objectMapper.writeValueAsString(rule),
            objectMapper.writeValueAsString(NoiseRules.CONTENT_LANDMARKS)
        );
    }

}
