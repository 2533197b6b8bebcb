package it.cavallium.sqlkeeper.core.common;

import java.io.IOException;

@FunctionalInterface
public interface FileOperation {

	void run() throws IOException;
}
