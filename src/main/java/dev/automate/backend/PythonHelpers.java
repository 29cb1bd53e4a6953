package dev.automate.backend;

/**
 * Helper functions the generated program defines before its setup block.
 */
public final class PythonHelpers {

    static final String SOCKET_SCREENSHOT = """
        def capture_screenshot_socket(host, port, remote_path, timeout=30):
            \"\"\"Save a screenshot on the instrument over a raw socket and return the image bytes.\"\"\"
            sock = socket.socket(socket.AF_INET, socket.SOCK_STREAM)
            sock.settimeout(timeout)
            sock.connect((host, port))
            try:
                def send(cmd):
                    sock.sendall((cmd + "\\n").encode())

                def query(cmd):
                    send(cmd)
                    reply = b""
                    while not reply.endswith(b"\\n"):
                        chunk = sock.recv(1)
                        if not chunk:
                            break
                        reply += chunk
                    return reply.decode().strip()

                send('SAVE:IMAGe "%s"' % remote_path)
                query("*OPC?")
                send('FILESystem:READFile "%s"' % remote_path)
                data = b""
                sock.settimeout(2)
                while True:
                    try:
                        chunk = sock.recv(65536)
                    except socket.timeout:
                        break
                    if not chunk:
                        break
                    data += chunk
                sock.settimeout(timeout)
                send('FILESystem:DELEte "%s"' % remote_path)
                return data
            finally:
                sock.close()
        """;

    private PythonHelpers() {}

    /** Source of the helper a feature stands for, or null when it is a plain import. */
    public static String source(ScriptFeature feature) {
        return feature == ScriptFeature.SOCKET_SCREENSHOT_HELPER ? SOCKET_SCREENSHOT : null;
    }
}
