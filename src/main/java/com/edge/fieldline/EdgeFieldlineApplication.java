package com.edge.fieldline;

import com.edge.fieldline.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdgeFieldlineApplication {

    public static void main(String[] args) {
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(EdgeFieldlineApplication.class, args);
    }
}
