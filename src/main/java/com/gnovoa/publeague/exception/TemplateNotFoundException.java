package com.gnovoa.publeague.exception;

import java.util.Collection;

public class TemplateNotFoundException extends SchedulingException {

    public TemplateNotFoundException(String divisionId, Collection<Long> templateIds) {
        super("TEMPLATE_NOT_FOUND",
                "Schedule templates " + templateIds + " not found in division " + divisionId,
                divisionId, templateIds);
    }
}
