package ch.so.arp.finrag.financials;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finrag.financials")
public class FinancialsProperties {

    /**
     * Resource pattern of the JSON statement files.
     */
    private String location = "classpath:financials/*.json";

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }
}
