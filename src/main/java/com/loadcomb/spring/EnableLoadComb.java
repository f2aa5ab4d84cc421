package com.loadcomb.spring;

import com.loadcomb.adapter.spring.LoadCombAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable load combination generation in a Spring Boot application.
 * 
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableLoadComb
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(LoadCombAutoConfiguration.class)
public @interface EnableLoadComb {
}
