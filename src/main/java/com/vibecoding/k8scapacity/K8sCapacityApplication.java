package com.vibecoding.k8scapacity;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
public class K8sCapacityApplication {

    private static final Logger log = LoggerFactory.getLogger(K8sCapacityApplication.class);

    public static void main(String[] args) {
        log.info("==============================================");
        log.info("  K8s Capacity - Resource Accounting Reports");
        log.info("==============================================");

        // .env 파일을 시스템 프로퍼티로 로드 (K8S_API_SERVER_URL, K8S_TOKEN)
        loadDotenv(".");

        SpringApplication.run(K8sCapacityApplication.class, args);

        log.info("Application started successfully!");
    }

    /**
     * .env 파일 로드. 실패해도 시스템 환경 변수로 계속 진행한다.
     */
    static boolean loadDotenv(String directory) {
        try {
            Dotenv dotenv = Dotenv.configure()
                .directory(directory)
                .ignoreIfMissing()
                .load();
            dotenv.entries().forEach(entry -> {
                if (System.getProperty(entry.getKey()) == null) {
                    System.setProperty(entry.getKey(), entry.getValue());
                    log.debug("Loaded environment variable: {}", entry.getKey());
                }
            });
            log.info("Environment variables loaded from .env file");
            return true;
        } catch (Exception e) {
            log.warn("Failed to load .env file: {}", e.getMessage());
            log.info("Continuing with system environment variables...");
            return false;
        }
    }
}
