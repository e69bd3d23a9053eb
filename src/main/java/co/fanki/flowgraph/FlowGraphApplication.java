package co.fanki.flowgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Flow Graph Knowledge application.
 *
 * <p>Hosts the services that analyze compiler-produced control-flow graphs
 * and project them into visualization-ready knowledge graphs.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class FlowGraphApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(FlowGraphApplication.class, args);
    }

}
