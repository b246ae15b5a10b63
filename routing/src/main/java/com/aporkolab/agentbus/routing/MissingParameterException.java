package com.aporkolab.agentbus.routing;

import com.aporkolab.agentbus.exception.MessagingException;

/**
 * A routing-key or queue-name template has a placeholder with no value.
 */
public class MissingParameterException extends MessagingException {

    private final String parameter;
    private final String template;

    public MissingParameterException(String parameter, String template) {
        super("MISSING_PARAMETER",
                String.format("Missing parameter '%s' for routing pattern %s", parameter, template));
        this.parameter = parameter;
        this.template = template;
        with("parameter", parameter);
        with("template", template);
    }

    public String getParameter() {
        return parameter;
    }

    public String getTemplate() {
        return template;
    }
}
