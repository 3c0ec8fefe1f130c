package com.rackspace.metrilake.app.config.configValidator;

import com.rackspace.metrilake.app.config.QueryProperties;
import javax.validation.ConstraintValidator;
import javax.validation.ConstraintValidatorContext;

public class ConcretePollBudgetValidator implements ConstraintValidator<PollBudgetValidator, QueryProperties> {

  @Override
  public boolean isValid(QueryProperties properties, ConstraintValidatorContext constraintValidatorContext) {
    if (properties == null || properties.getPoll() == null
        || properties.getPoll().getBudget() == null || properties.getExecutionDeadline() == null) {
      // field level constraints report the missing values
      return true;
    }
    return properties.getPoll().getBudget().compareTo(properties.getExecutionDeadline()) < 0;
  }
}
