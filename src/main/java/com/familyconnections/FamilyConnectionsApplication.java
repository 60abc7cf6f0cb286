package com.familyconnections;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Main application class for the family-connection scoring engine.
 *
 * <p>Scores pairs of corporate officers for signs of a family relationship
 * from five independent signals:
 *
 * <ul>
 *   <li><strong>Name</strong>: fuzzy surname match and shared middle names</li>
 *   <li><strong>Age</strong>: sibling-range or generational age gaps</li>
 *   <li><strong>Appointment</strong>: shared companies and synchronized appointment events</li>
 *   <li><strong>Address</strong>: exact match or geographic proximity</li>
 *   <li><strong>Company name</strong>: a company named after the other officer</li>
 * </ul>
 *
 * <p>The engine is a library first; this class wires it with configuration
 * binding, detector timing and the group-analysis executor.
 *
 * @author Platform Team
 * @since 1.0.0
 */
@SpringBootApplication
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class FamilyConnectionsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FamilyConnectionsApplication.class, args);

        log.info("Family connection scoring engine started");
    }
}
