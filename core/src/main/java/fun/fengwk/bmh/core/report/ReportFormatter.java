package fun.fengwk.bmh.core.report;

import freemarker.template.Template;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.StringWriter;
import java.util.Map;

/**
 * @author fengwk
 */
@Component
public class ReportFormatter {

    private final freemarker.template.Configuration reportTemplateConfiguration;

    public ReportFormatter(@Qualifier("reportTemplateConfiguration") freemarker.template.Configuration reportTemplateConfiguration) {
        this.reportTemplateConfiguration = reportTemplateConfiguration;
    }

    public String format(String templateName, Object model) {
        if (model == null) {
            return "empty report";
        }
        StringWriter result = new StringWriter(1024);
        try {
            Template template = reportTemplateConfiguration.getTemplate(templateName);
            Object root = model instanceof Map ? model : Map.of("data", model);
            template.process(root, result);
            return result.toString();
        } catch (Exception e) {
            return "format error: " + e.getMessage();
        }
    }

}
