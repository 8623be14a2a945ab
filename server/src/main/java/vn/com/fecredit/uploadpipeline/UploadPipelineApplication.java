package vn.com.fecredit.uploadpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EntityScan("vn.com.fecredit.uploadpipeline.model")
@EnableJpaRepositories("vn.com.fecredit.uploadpipeline.model")
public class UploadPipelineApplication {
    /**
     * Entry point; runs the pipeline with its scheduled cleanup and stage executor.
     *
     * @param args Command line arguments passed to the application.
     */
    public static void main(String[] args) {
        SpringApplication.run(UploadPipelineApplication.class, args);
    }
}
