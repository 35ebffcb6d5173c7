package app.fsidrill.srs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class SrsApplication {

	public static void main(String[] args) {
		SpringApplication.run(SrsApplication.class, args);
	}

}
