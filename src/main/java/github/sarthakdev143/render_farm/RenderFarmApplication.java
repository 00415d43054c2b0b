package github.sarthakdev143.render_farm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RenderFarmApplication {

	public static void main(String[] args) {
		SpringApplication.run(RenderFarmApplication.class, args);
		System.out.println("\r\n" + //
				"  _ __ ___ _ __   __| | ___ _ __   / _| __ _ _ __ _ __ ___  \r\n" + //
				" | '__/ _ \\ '_ \\ / _` |/ _ \\ '__| | |_ / _` | '__| '_ ` _ \\ \r\n" + //
				" | | |  __/ | | | (_| |  __/ |    |  _| (_| | |  | | | | | |\r\n" + //
				" |_|  \\___|_| |_|\\__,_|\\___|_|    |_|  \\__,_|_|  |_| |_| |_|\r\n");
	}

}
