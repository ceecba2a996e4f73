package ch.realestate.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

// the store client is owned by DatabaseConfig, see StoreContext
@RestController
@SpringBootApplication(exclude = {MongoAutoConfiguration.class, MongoDataAutoConfiguration.class})
public class RealEstateBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(RealEstateBackendApplication.class, args);
	}

	@GetMapping("/")
	@ResponseStatus(HttpStatus.OK)
	public Map<String, String> root() {
		return Map.of("message", "Real Estate API is running");
	}

	@GetMapping("/api/hello")
	@ResponseStatus(HttpStatus.OK)
	public Map<String, String> hello() {
		return Map.of("message", "Welcome to your real estate backend!");
	}
}
