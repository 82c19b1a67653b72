import driver.*;

public class Optimizer {
    /*
     * move the duty of optimizer to driver,
     * for we can't use package here
     */
    public static void main(String[] args) {
        OptimizerDriver driver = OptimizerDriver.getInstance();
        driver.parseArgs(args);
        driver.run();
    }
}
