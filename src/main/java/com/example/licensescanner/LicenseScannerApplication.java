package com.example.licensescanner;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@OpenAPIDefinition(
        info = @Info(
                title = "Driver's License Scanner API",
                version = "1.0",
                description = "REST API for extracting the document number, issuing region, names and date of birth "
                        + "from driver's license images or pre-recognised text lines.",
                contact = @Contact(name = "License Scanner")))
@SpringBootApplication
@ConfigurationPropertiesScan
public class LicenseScannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LicenseScannerApplication.class, args);
    }
}
