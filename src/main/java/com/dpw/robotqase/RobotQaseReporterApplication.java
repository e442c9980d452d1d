package com.dpw.robotqase;

import com.dpw.robotqase.command.ReportCommand;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@RequiredArgsConstructor
public class RobotQaseReporterApplication implements CommandLineRunner, ExitCodeGenerator {

	private final ReportCommand reportCommand;
	private int exitCode;

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(RobotQaseReporterApplication.class, args)));
	}

	@Override
	public void run(String... args) {
		exitCode = ReportCommand.commandLine(reportCommand).execute(args);
	}

	@Override
	public int getExitCode() {
		return exitCode;
	}
}
