package ir.ipaam.docrender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocRenderApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocRenderApplication.class, args);
    }
}
