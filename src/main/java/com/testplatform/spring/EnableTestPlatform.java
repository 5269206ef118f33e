package com.testplatform.spring;

import com.testplatform.adapter.spring.TestPlatformAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the test platform request manager in a Spring Boot application.
 * The application supplies the {@link com.testplatform.client.TestEngine} bean.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableTestPlatform
 * public class RunnerApplication {
 *     &#64;Bean
 *     public TestEngine testEngine() {
 *         return new ProcessTestEngine();
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(TestPlatformAutoConfiguration.class)
public @interface EnableTestPlatform {
}
