package uk.gegc.courseblocks;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CourseBlocksApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourseBlocksApplication.class, args);
    }
}
