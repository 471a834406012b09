package co.fanki.drivesync.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for Drive Git Sync.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Drive Git Sync API")
                        .description("""
                                Drive Git Sync - Mirrors a Google Drive folder into a git repository,
                                one commit per editor, with diffable text next to every document.

                                ## Features
                                - **Webhook**: Drive push notifications trigger incremental syncs
                                - **Subscription**: Open and renew the Drive watch channel
                                - **Status**: Inspect the change cursor, the lock and tracked files

                                ## Derived text
                                - `.docx` and Google Docs: markdown through pandoc
                                - `.pdf` and Google Slides: plain text per page
                                - `.csv` and Google Sheets: markdown tables
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
