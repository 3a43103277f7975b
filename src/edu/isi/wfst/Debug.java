package edu.isi.wfst;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// diagnostics for the transducer code. everything goes to stderr.
// per-method tracing is switched with a local "boolean debug" in the caller,
// timing output with the global level
public class Debug {

	static String encoding = "utf-8";
	public static void setEncoding(String s) {
		encoding = s;
		w = null;
	}

	private static OutputStreamWriter w=null;
	private static OutputStreamWriter writer() {
		if (w == null) {
			try {
				w = new OutputStreamWriter(System.err, encoding);
			}
			catch (UnsupportedEncodingException e) {
				System.err.println("Warning: encoding "+encoding+" not supported; using default");
				w = new OutputStreamWriter(System.err);
			}
		}
		return w;
	}

	private static void write(String s) {
		try {
			OutputStreamWriter out = writer();
			out.write(s+"\n");
			out.flush();
		}
		catch (IOException e) {
			System.err.println("IOException while trying to print "+s);
		}
	}

	// stuff we always print
	public static void prettyDebug(String s) {
		write(s);
	}

	// tracing, tagged with the calling class and method
	public static void debug(boolean d, String s)  {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		write(caller.getClassName()+":"+caller.getMethodName()+" : "+s);
	}

	private static int dblevel=0;
	public static void setDbLevel(int i) {
		dblevel = i;
	}
	public static int getDbLevel() {
		return dblevel;
	}

	// elapsed time since pta, if the global level is high enough
	public static void dbtime(int needlevel, Date pta, String msg) {
		if (dblevel < needlevel)
			return;
		long x = new Date().getTime() - pta.getTime();
		write(msg+": "+x+" ms");
	}

	// plain message gated by the global level
	public static void dblog(int needlevel, String msg) {
		if (dblevel < needlevel)
			return;
		write(msg);
	}
}
