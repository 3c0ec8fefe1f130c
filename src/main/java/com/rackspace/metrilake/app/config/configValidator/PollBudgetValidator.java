package com.rackspace.metrilake.app.config.configValidator;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import javax.validation.Constraint;
import javax.validation.Payload;

@Constraint(validatedBy = ConcretePollBudgetValidator.class)
@Target({ ElementType.TYPE })
@Retention(RetentionPolicy.RUNTIME)
public @interface PollBudgetValidator {
  String message() default "Poll budget must be shorter than the execution deadline";
  Class<?>[] groups() default {};
  Class<? extends Payload>[] payload() default {};
}
