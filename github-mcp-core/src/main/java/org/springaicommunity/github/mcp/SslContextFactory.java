package org.springaicommunity.github.mcp;

import org.jspecify.annotations.Nullable;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Collection;

/**
 * Builds the {@link SSLContext} used for GitHub calls from {@link GitHubProperties}.
 *
 * <ul>
 * <li>verification on, no bundle: JVM default trust store</li>
 * <li>verification on, bundle set: only the CAs in the PEM bundle are trusted</li>
 * <li>verification off: any certificate and host name is accepted</li>
 * </ul>
 */
final class SslContextFactory {

	private SslContextFactory() {
	}

	static SSLContext create(GitHubProperties properties) {
		try {
			if (!properties.isSslVerify()) {
				SSLContext context = SSLContext.getInstance("TLS");
				context.init(null, new TrustManager[] { new TrustAllManager() }, new SecureRandom());
				return context;
			}
			String certFile = properties.getSslCertFile();
			if (certFile == null) {
				return SSLContext.getDefault();
			}
			TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
			factory.init(loadBundle(Path.of(certFile)));
			SSLContext context = SSLContext.getInstance("TLS");
			context.init(null, factory.getTrustManagers(), new SecureRandom());
			return context;
		}
		catch (GeneralSecurityException | IOException e) {
			throw new IllegalStateException("Unable to configure TLS: " + e.getMessage(), e);
		}
	}

	static KeyStore loadBundle(Path bundle) throws GeneralSecurityException, IOException {
		KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
		keyStore.load(null, null);
		Collection<? extends Certificate> certificates;
		try (InputStream in = Files.newInputStream(bundle)) {
			certificates = CertificateFactory.getInstance("X.509").generateCertificates(in);
		}
		if (certificates.isEmpty()) {
			throw new GeneralSecurityException("No certificates found in " + bundle);
		}
		int index = 0;
		for (Certificate certificate : certificates) {
			keyStore.setCertificateEntry("ca-" + index++, certificate);
		}
		return keyStore;
	}

	/**
	 * Accepts every chain. Extending {@link X509ExtendedTrustManager} also skips the JDK's
	 * endpoint identification check.
	 */
	private static final class TrustAllManager extends X509ExtendedTrustManager {

		@Override
		public void checkClientTrusted(X509Certificate[] chain, String authType, @Nullable Socket socket) {
		}

		@Override
		public void checkServerTrusted(X509Certificate[] chain, String authType, @Nullable Socket socket) {
		}

		@Override
		public void checkClientTrusted(X509Certificate[] chain, String authType, @Nullable SSLEngine engine) {
		}

		@Override
		public void checkServerTrusted(X509Certificate[] chain, String authType, @Nullable SSLEngine engine) {
		}

		@Override
		public void checkClientTrusted(X509Certificate[] chain, String authType) {
		}

		@Override
		public void checkServerTrusted(X509Certificate[] chain, String authType) {
		}

		@Override
		public X509Certificate[] getAcceptedIssuers() {
			return new X509Certificate[0];
		}

	}

}
