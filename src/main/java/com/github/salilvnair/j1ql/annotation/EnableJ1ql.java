package com.github.salilvnair.j1ql.annotation;

import com.github.salilvnair.j1ql.config.J1qlAutoConfiguration;
import org.springframework.context.annotation.Import;
import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(J1qlAutoConfiguration.class)
public @interface EnableJ1ql {
}
