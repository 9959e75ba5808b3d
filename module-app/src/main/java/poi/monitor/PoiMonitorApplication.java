package poi.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PoiMonitorApplication {

  public static void main(String[] args) {
    SpringApplication.run(PoiMonitorApplication.class, args);
  }
}
