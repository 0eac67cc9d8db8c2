package com.nowa.archive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ArchiveApplication {

    public static void main(String[] args) {
        // exit code 反映指令結果（reconcile 有差異 -> 1）
        System.exit(SpringApplication.exit(SpringApplication.run(ArchiveApplication.class, args)));
    }
}
