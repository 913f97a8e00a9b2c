package org.smileyface.linkmeta;

import org.smileyface.linkmeta.config.LinkMetadataProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LinkMetadataProperties.class)
public class LinkMetadataApplication {

	public static void main(String[] args) {
		SpringApplication.run(LinkMetadataApplication.class, args);
	}
}
